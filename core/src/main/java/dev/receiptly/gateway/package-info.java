/**
 * Failure types shared by the clients of external gateways (embedding model, object storage, Firestore).
 */
package dev.receiptly.gateway;
