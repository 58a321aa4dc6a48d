package io.kubeclient.client.resources;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.net.URLEncoder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.kubeclient.util.Assert;
import io.kubeclient.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * An API path template plus the values that complete it.
 * <p>
 * Placeholders look like {@code {name}} and are replaced with URL-encoded values. Query
 * parameters whose value is {@code null} or blank are left out. Instances are immutable;
 * {@link #with(String, String)} and {@link #query(String, Object)} return copies, so templates
 * can be kept in constants.
 *
 * <pre>{@code
 * ResourceRequest.of("/api/v1/namespaces/{namespace}/configmaps/{name}")
 *         .with("namespace", "default")
 *         .with("name", "settings")
 *         .path();   // "/api/v1/namespaces/default/configmaps/settings"
 * }</pre>
 */
public final class ResourceRequest {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");

    private final String pathTemplate;
    private final Map<String, String> parameters;
    private final Map<String, String> queryParameters;

    private ResourceRequest(String pathTemplate, Map<String, String> parameters, Map<String, String> queryParameters) {
        this.pathTemplate = pathTemplate;
        this.parameters = parameters;
        this.queryParameters = queryParameters;
    }

    public static ResourceRequest of(String pathTemplate) {
        Assert.checkNotBlankParam("pathTemplate", pathTemplate);
        if (!pathTemplate.startsWith("/")) {
            throw new IllegalArgumentException("Path template must start with '/': " + pathTemplate);
        }
        return new ResourceRequest(pathTemplate, Map.of(), Map.of());
    }

    public String getPathTemplate() {
        return pathTemplate;
    }

    /**
     * @return a copy of this request with the placeholder {@code name} bound to {@code value}
     */
    public ResourceRequest with(String name, String value) {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotNullParam(name, value);
        Map<String, String> copy = new LinkedHashMap<>(parameters);
        copy.put(name, value);
        return new ResourceRequest(pathTemplate, Collections.unmodifiableMap(copy), queryParameters);
    }

    /**
     * @return a copy of this request with the query parameter set, or removed when {@code value}
     *         is {@code null} or blank
     */
    public ResourceRequest query(String name, @Nullable Object value) {
        Assert.checkNotBlankParam("name", name);
        Map<String, String> copy = new LinkedHashMap<>(queryParameters);
        String text = value == null ? null : value.toString();
        if (Utils.isBlank(text)) {
            copy.remove(name);
        } else {
            copy.put(name, text);
        }
        return new ResourceRequest(pathTemplate, parameters, Collections.unmodifiableMap(copy));
    }

    /**
     * Expands the template.
     *
     * @return the request path with its query string
     * @throws IllegalArgumentException if a placeholder has no value
     */
    public String path() {
        Matcher matcher = PLACEHOLDER.matcher(pathTemplate);
        StringBuilder path = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = parameters.get(name);
            if (value == null) {
                throw new IllegalArgumentException(
                        "No value for placeholder '" + name + "' in path template " + pathTemplate);
            }
            matcher.appendReplacement(path, Matcher.quoteReplacement(encode(value)));
        }
        matcher.appendTail(path);

        char separator = '?';
        for (Map.Entry<String, String> entry : queryParameters.entrySet()) {
            path.append(separator).append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
            separator = '&';
        }
        return path.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, UTF_8).replace("+", "%20");
    }

    @Override
    public String toString() {
        return "ResourceRequest{" + pathTemplate + ", parameters=" + parameters + ", query=" + queryParameters + "}";
    }
}
