package dev.receiptly;

import org.springframework.modulith.Modulithic;

/**
 * Anchor type for the application modules living below {@code dev.receiptly}.
 */
@Modulithic(systemName = "Receiptly core")
public class CoreModulithConfiguration {
}
