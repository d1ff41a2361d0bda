/**
 * Tool surface exposed to the model: argument validation, orchestration of the receipt store, the conversation
 * context and the blob gateway, and mapping of failures onto {@link dev.receiptly.tools.ToolErrorCode}s.
 */
package dev.receiptly.tools;
