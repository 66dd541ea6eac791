package com.capgate.gatekeeper.workspace;

/**
 * Thrown when a diff cannot be applied to the workspace.
 *
 * Unchecked and propagated unchanged through the approval gate. On the
 * approve path the approval stays pending so the operator can fix the
 * cause and resolve again.
 */
public class WorkspaceException extends RuntimeException {

    public enum Kind { PATH_ESCAPE, PATCH_REJECTED, IO_FAILURE }

    private final Kind   kind;
    private final String path;

    public WorkspaceException(Kind kind, String path, String message) {
        super("[" + kind + "] " + path + ": " + message);
        this.kind = kind;
        this.path = path;
    }

    public WorkspaceException(Kind kind, String path, String message, Throwable cause) {
        super("[" + kind + "] " + path + ": " + message, cause);
        this.kind = kind;
        this.path = path;
    }

    public Kind   getKind() { return kind; }

    /** The diff path as supplied by the caller. */
    public String getPath() { return path; }
}
