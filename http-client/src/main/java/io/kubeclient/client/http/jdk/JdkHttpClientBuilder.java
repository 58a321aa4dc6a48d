package io.kubeclient.client.http.jdk;

import io.kubeclient.client.http.HttpClient;
import io.kubeclient.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url);
    }
}
