package com.seqmine.core.model;

/**
 * One item of an encoded transaction.
 * 
 * @param eventId 1-based ordinal of the event within its session
 * @param symbol  sanitized action symbol, treated as an atomic categorical token
 */
public record TransactionItem(int eventId, String symbol) {
}
