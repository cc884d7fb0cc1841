package com.catalogharvester.crawl.link;

import com.catalogharvester.crawl.model.LinkScope;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a discovered link is queued: same site (with or without {@code www.}),
 * not an asset, not a denied path and, for restricted scopes, matching one of the scope patterns.
 */
public class FollowPolicy {
    private final Set<String> allowedHosts;
    private final List<Pattern> followPatterns;
    private final List<Pattern> denyPatterns;
    private final Set<String> denyExtensions;

    public FollowPolicy(String siteHost, LinkScope scope, LinkRules rules) {
        String host = siteHost.toLowerCase(Locale.ROOT);
        this.allowedHosts = Set.of(host, host.startsWith("www.") ? host.substring(4) : "www." + host);
        this.followPatterns = rules.followPatterns(scope);
        this.denyPatterns = rules.denyPatterns();
        this.denyExtensions = rules.denyExtensions();
    }

    public boolean allows(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return false;
        }
        if (!allowedHosts.contains(uri.getHost().toLowerCase(Locale.ROOT))) {
            return false;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        int dot = path.lastIndexOf('.');
        if (dot > path.lastIndexOf('/') && denyExtensions.contains(path.substring(dot + 1))) {
            return false;
        }
        for (Pattern deny : denyPatterns) {
            if (deny.matcher(url).find()) {
                return false;
            }
        }
        if (followPatterns.isEmpty()) {
            return true;
        }
        for (Pattern allow : followPatterns) {
            if (allow.matcher(url).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops the fragment so "#reviews" links do not count as new pages.
     */
    public static String normalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        int hash = trimmed.indexOf('#');
        return hash >= 0 ? trimmed.substring(0, hash) : trimmed;
    }

    static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
