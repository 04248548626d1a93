package fr.lapetina.resilienthttp.domain.body;

/**
 * Identity of the storage behind an entity body.
 */
public enum SourceKind {
    /** Backed by a file on the local file system */
    LOCAL_FILE,

    /** Backed by process memory, gone once released */
    TRANSIENT
}
