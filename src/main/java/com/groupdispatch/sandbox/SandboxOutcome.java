package com.groupdispatch.sandbox;

/**
 * Result of one sandbox run.
 *
 * @param status            success or error
 * @param error             failure description (null on success)
 * @param continuationToken last token the sandbox reported (nullable)
 * @param exitCode          process exit code, null if the process never started or did not exit
 * @param resultSeen        whether at least one {@code result} event arrived
 */
public record SandboxOutcome(
    Status status,
    String error,
    String continuationToken,
    Integer exitCode,
    boolean resultSeen
) {

    public enum Status { SUCCESS, ERROR }

    public static SandboxOutcome success(String continuationToken, int exitCode) {
        return new SandboxOutcome(Status.SUCCESS, null, continuationToken, exitCode, true);
    }

    public static SandboxOutcome error(String error) {
        return new SandboxOutcome(Status.ERROR, error, null, null, false);
    }

    public static SandboxOutcome error(String error, String continuationToken, Integer exitCode, boolean resultSeen) {
        return new SandboxOutcome(Status.ERROR, error, continuationToken, exitCode, resultSeen);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
