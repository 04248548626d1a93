package fr.lapetina.resilienthttp.domain.model;

/**
 * Lifecycle state of a transfer request.
 */
public enum RequestState {
    /** Built or reset for (re)dispatch, not yet handed to a transport */
    NEW,

    /** Handed to a transport, awaiting the response */
    TRANSFER,

    /** A response has been received and attached */
    COMPLETE,

    /** The transport failed without producing a response */
    ERROR
}
