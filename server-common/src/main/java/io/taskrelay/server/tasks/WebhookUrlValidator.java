package io.taskrelay.server.tasks;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Map;

import io.taskrelay.spec.InvalidParamsError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects webhook destinations that would let a caller reach the server's own network.
 * <p>
 * Only {@code http} and {@code https} URLs are accepted, and every address the host
 * resolves to must be public: loopback, wildcard, link-local, site-local, unique local
 * ({@code fc00::/7}), carrier-grade NAT ({@code 100.64.0.0/10}) and multicast addresses are
 * refused unless private destinations are explicitly allowed.
 * <p>
 * Validation runs when a webhook is registered and again before each delivery, so a host
 * whose DNS record changes after registration is still caught.
 */
public class WebhookUrlValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookUrlValidator.class);

    /**
     * Resolves host names, replaceable in tests.
     */
    @FunctionalInterface
    public interface AddressResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final boolean allowPrivateDestinations;
    private final AddressResolver resolver;

    public WebhookUrlValidator(boolean allowPrivateDestinations) {
        this(allowPrivateDestinations, InetAddress::getAllByName);
    }

    public WebhookUrlValidator(boolean allowPrivateDestinations, AddressResolver resolver) {
        this.allowPrivateDestinations = allowPrivateDestinations;
        this.resolver = resolver;
    }

    /**
     * @param url the webhook URL
     * @return the parsed URL
     * @throws InvalidParamsError if the URL is malformed or targets a forbidden destination
     */
    public URI validate(String url) throws InvalidParamsError {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw invalid(url, "Webhook URL is malformed");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw invalid(url, "Webhook URL must use http or https");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw invalid(url, "Webhook URL has no host");
        }
        if (allowPrivateDestinations) {
            return uri;
        }

        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            throw invalid(url, "Webhook host cannot be resolved");
        }
        for (InetAddress address : addresses) {
            if (isForbidden(address)) {
                LOGGER.warn("Rejected webhook destination {} resolving to {}", url, address.getHostAddress());
                throw invalid(url, "Webhook URL targets a private or reserved address");
            }
        }
        return uri;
    }

    static boolean isForbidden(InetAddress address) {
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet6Address) {
            // fc00::/7
            return (bytes[0] & 0xFE) == 0xFC;
        }
        // 100.64.0.0/10
        return (bytes[0] & 0xFF) == 100 && (bytes[1] & 0xC0) == 64;
    }

    private static InvalidParamsError invalid(String url, String message) {
        return new InvalidParamsError(message, Map.of("field", "url", "url", url));
    }
}
