package io.taskrelay.client.http.jdk;

import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url);
    }
}
