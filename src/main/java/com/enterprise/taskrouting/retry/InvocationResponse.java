package com.enterprise.taskrouting.retry;

/**
 * Response of one external action invocation
 */
public final class InvocationResponse {

    private final boolean success;
    private final String detail;

    public InvocationResponse(boolean success, String detail) {
        this.success = success;
        this.detail = detail != null ? detail : "";
    }

    public static InvocationResponse success(String detail) {
        return new InvocationResponse(true, detail);
    }

    public static InvocationResponse failure(String detail) {
        return new InvocationResponse(false, detail);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return (success ? "success" : "failure") + ": " + detail;
    }
}
