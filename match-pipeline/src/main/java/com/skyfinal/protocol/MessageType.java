package com.skyfinal.protocol;

/**
 * Defines all message types of the event stream protocol.
 *
 * Client → Server:
 * - GET_EVENTS: Request the latest tactical events
 * - GET_CONCLUSIONS: Request the latest tactical conclusions
 * - GET_HISTORY: Request the persisted snapshot history
 * - GET_STATUS: Request a one-line round status
 * - CLEAR_EVENTS: Drain the tactical event log
 *
 * Server → Client (pushed):
 * - TACTICAL_EVENT: A new tactical event was logged
 * - CONCLUSION: A new tactical conclusion was drawn
 * - VISUAL_EVENT: The visual channel surfaced a classification
 *
 * Server → Client (replies):
 * - EVENTS, CONCLUSIONS, HISTORY, STATUS
 * - ERROR: Error notification
 */
public enum MessageType {
    // Client → Server
    GET_EVENTS,
    GET_CONCLUSIONS,
    GET_HISTORY,
    GET_STATUS,
    CLEAR_EVENTS,

    // Server → Client
    TACTICAL_EVENT,
    CONCLUSION,
    VISUAL_EVENT,
    EVENTS,
    CONCLUSIONS,
    HISTORY,
    STATUS,
    ERROR
}
