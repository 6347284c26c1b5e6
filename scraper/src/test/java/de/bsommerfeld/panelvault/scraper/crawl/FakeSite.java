package de.bsommerfeld.panelvault.scraper.crawl;

import de.bsommerfeld.panelvault.core.error.AcquisitionException;
import de.bsommerfeld.panelvault.scraper.http.FetchResponse;
import de.bsommerfeld.panelvault.scraper.http.HttpFetcher;
import de.bsommerfeld.panelvault.scraper.http.HttpHeaders;
import de.bsommerfeld.panelvault.scraper.http.TempDownload;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory website. Unknown URLs answer 404. Every request is recorded with
 * its Referer.
 */
class FakeSite implements HttpFetcher {

    record Request(String url, String referer) {
    }

    private final Map<String, FetchResponse> responses = new ConcurrentHashMap<>();
    private final List<Request> requests = new ArrayList<>();

    /** Serves a comic page. {@code next} may be null. */
    FakeSite page(String url, String title, String next, String... images) {
        StringBuilder html = new StringBuilder("<html><head><title>ignored</title></head><body>");
        if (title != null) {
            html.append("<h1 class=\"title\">").append(title).append("</h1>");
        }
        html.append("<div id=\"comic\">");
        for (String image : images) {
            html.append("<img src=\"").append(image).append("\">");
        }
        html.append("</div>");
        if (next != null) {
            html.append("<a class=\"next\" href=\"").append(next).append("\">Next</a>");
        }
        html.append("</body></html>");
        responses.put(url, new FetchResponse(200, HttpHeaders.of("Content-Type", "text/html; charset=utf-8"),
                html.toString().getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    FakeSite image(String url, byte[] bytes) {
        responses.put(url, new FetchResponse(200, HttpHeaders.of("Content-Type", "image/png"), bytes));
        return this;
    }

    FakeSite status(String url, int status) {
        responses.put(url, new FetchResponse(status, HttpHeaders.empty(), new byte[0]));
        return this;
    }

    synchronized List<Request> requests() {
        return new ArrayList<>(requests);
    }

    synchronized List<String> requestedUrls() {
        return requests.stream().map(Request::url).toList();
    }

    @Override
    public FetchResponse get(String url, String referer) throws AcquisitionException {
        synchronized (this) {
            requests.add(new Request(url, referer));
        }
        FetchResponse response = responses.get(url);
        return response != null ? response : new FetchResponse(404, HttpHeaders.empty(), new byte[0]);
    }

    @Override
    public FetchResponse head(String url, String referer) throws AcquisitionException {
        FetchResponse full = get(url, referer);
        return new FetchResponse(full.status(), full.headers(), null);
    }

    @Override
    public TempDownload downloadToTemp(String url, String referer, Path directory) {
        throw new UnsupportedOperationException("Crawler tests never download to disk");
    }
}
