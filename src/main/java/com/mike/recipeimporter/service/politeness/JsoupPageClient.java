package com.mike.recipeimporter.service.politeness;

import com.mike.recipeimporter.config.ImporterProperties;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@Slf4j
public class JsoupPageClient implements PageClient {

    private final String userAgent;

    public JsoupPageClient(ImporterProperties props) {
        this.userAgent = props.getCrawling().getUserAgent();
    }

    @Override
    public FetchedPage get(String url, int timeoutMs) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(0)
                .method(Connection.Method.GET)
                .execute();

        log.debug("JsoupPageClient: GET url={} status={}", url, response.statusCode());
        return new FetchedPage(response.statusCode(), response.body(), response.contentType());
    }

    @Override
    public int head(String url, int timeoutMs) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .method(Connection.Method.HEAD)
                .execute();

        log.debug("JsoupPageClient: HEAD url={} status={}", url, response.statusCode());
        return response.statusCode();
    }
}
