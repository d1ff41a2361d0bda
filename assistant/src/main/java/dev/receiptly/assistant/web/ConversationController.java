package dev.receiptly.assistant.web;

import dev.receiptly.conversation.ConversationContextService;
import dev.receiptly.conversation.ConversationTurn;
import dev.receiptly.conversation.ImageAttachment;
import dev.receiptly.conversation.ImageUnavailableException;
import dev.receiptly.conversation.RenderedTurn;
import dev.receiptly.conversation.ResolvedImage;
import dev.receiptly.conversation.TurnReceipt;
import dev.receiptly.tools.InvalidArgumentException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP access to conversation sessions: recording turns, reading the compacted context and resolving image
 * references. Image bytes travel as base64 inside JSON.
 */
@RestController
@RequestMapping(path = "/api/sessions")
public class ConversationController {

    static final String IMAGE_SOURCE_HEADER = "X-Image-Source";

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationContextService conversation;

    public ConversationController(ConversationContextService conversation) {
        this.conversation = conversation;
    }

    @PostMapping(path = "/{sessionId}/turns", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public TurnReceipt recordUserTurn(@PathVariable("sessionId") String sessionId,
        @RequestBody UserTurnRequest request) {

        List<ImageAttachment> attachments = new ArrayList<>();
        List<ImageUpload> images = request.images() != null ? request.images() : List.of();
        for (int i = 0; i < images.size(); i++) {
            attachments.add(decode("images[" + i + "]", images.get(i)));
        }
        return conversation.recordUserTurn(sessionId, request.text(), attachments);
    }

    @PostMapping(path = "/{sessionId}/assistant-turns", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public TurnReceipt recordAssistantTurn(@PathVariable("sessionId") String sessionId,
        @RequestBody AssistantTurnRequest request) {
        return conversation.recordAssistantTurn(sessionId, request.text());
    }

    @GetMapping(path = "/{sessionId}/context", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<RenderedTurn> context(@PathVariable("sessionId") String sessionId) {
        return conversation.render(sessionId);
    }

    @GetMapping(path = "/{sessionId}/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ConversationTurn> history(@PathVariable("sessionId") String sessionId) {
        return conversation.history(sessionId);
    }

    @GetMapping(path = "/{sessionId}/images/{reference}")
    public ResponseEntity<byte[]> image(@PathVariable("sessionId") String sessionId,
        @PathVariable("reference") String reference) {

        ResolvedImage image = conversation.resolve(sessionId, reference);
        MediaType contentType = StringUtils.hasText(image.mimeType())
            ? MediaType.parseMediaType(image.mimeType())
            : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok()
            .contentType(contentType)
            .header(IMAGE_SOURCE_HEADER, image.source().name())
            .body(image.content());
    }

    @DeleteMapping(path = "/{sessionId}")
    public ResponseEntity<Void> evict(@PathVariable("sessionId") String sessionId) {
        return conversation.evict(sessionId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @ExceptionHandler(ImageUnavailableException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleImageUnavailable(ImageUnavailableException exception) {
        return Map.of("error", exception.getMessage(), "reference", exception.getReference());
    }

    @ExceptionHandler({InvalidArgumentException.class, IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidArgument(RuntimeException exception) {
        LOGGER.warn("Rejected conversation request: {}", exception.getMessage());
        return Map.of("error", String.valueOf(exception.getMessage()));
    }

    private static ImageAttachment decode(String argument, ImageUpload upload) {
        if (upload == null || !StringUtils.hasText(upload.data())) {
            throw new InvalidArgumentException(argument, argument + " must carry base64 data");
        }
        byte[] content;
        try {
            content = Base64.getDecoder().decode(upload.data().strip());
        } catch (IllegalArgumentException ex) {
            throw new InvalidArgumentException(argument, argument + " is not valid base64", ex);
        }
        return new ImageAttachment(content, upload.mimeType());
    }

    public record UserTurnRequest(String text, List<ImageUpload> images) { }

    public record ImageUpload(String mimeType, String data) { }

    public record AssistantTurnRequest(String text) { }
}
