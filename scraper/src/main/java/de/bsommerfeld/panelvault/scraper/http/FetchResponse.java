package de.bsommerfeld.panelvault.scraper.http;

/**
 * An in-memory HTTP response.
 */
public record FetchResponse(int status, HttpHeaders headers, byte[] body) {

    public FetchResponse {
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : new byte[0];
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
