package edu.washu.tag.provisioning.client;

/**
 * Thrown when the content service answers with a non-success status.
 */
public class ApiException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public ApiException(String operation, int statusCode, String responseBody) {
        super("Failed to " + operation + " (" + statusCode + "): " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

}
