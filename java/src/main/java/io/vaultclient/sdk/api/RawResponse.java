package io.vaultclient.sdk.api;

import java.util.Arrays;

/**
 * Undecoded HTTP response: the status code and the full body. {@code body} is never {@code null}; it is copied on the
 * way in and out, and compared by content.
 */
public record RawResponse(int statusCode, byte[] body) {

    public RawResponse {
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RawResponse)) {
            return false;
        }
        RawResponse that = (RawResponse) other;
        return statusCode == that.statusCode && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(statusCode) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "RawResponse[statusCode=" + statusCode + ", body=" + body.length + " bytes]";
    }
}
