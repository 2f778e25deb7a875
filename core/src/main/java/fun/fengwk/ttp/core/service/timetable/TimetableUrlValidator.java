package fun.fengwk.ttp.core.service.timetable;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Validates and normalizes timetable urls before any browser resource is spent.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class TimetableUrlValidator {

    private final TimetableProperties timetableProperties;

    public UrlValidation validate(String url) {
        if (!StringUtils.hasText(url)) {
            return UrlValidation.rejected("url is blank");
        }
        String normalizedUrl = url.trim();
        String lowerCaseUrl = normalizedUrl.toLowerCase(Locale.ROOT);
        if (!lowerCaseUrl.startsWith("http://") && !lowerCaseUrl.startsWith("https://")) {
            return UrlValidation.rejected("unsupported url protocol");
        }

        String host;
        try {
            host = new URI(normalizedUrl).getHost();
        } catch (URISyntaxException ex) {
            return UrlValidation.rejected("malformed url");
        }
        if (!StringUtils.hasText(host)) {
            return UrlValidation.rejected("malformed url");
        }
        if (!isAllowedHost(host.toLowerCase(Locale.ROOT))) {
            return UrlValidation.rejected("url host is not allowed: " + host);
        }
        return UrlValidation.ok(normalizedUrl);
    }

    private boolean isAllowedHost(String host) {
        if (timetableProperties.getAllowedHosts() == null) {
            return false;
        }
        for (String allowedHost : timetableProperties.getAllowedHosts()) {
            if (!StringUtils.hasText(allowedHost)) {
                continue;
            }
            String normalizedAllowed = allowedHost.trim().toLowerCase(Locale.ROOT);
            if (host.equals(normalizedAllowed) || host.endsWith("." + normalizedAllowed)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Validation outcome.
     *
     * @param valid whether the url may be scraped
     * @param url normalized url when valid
     * @param reason rejection reason when invalid
     */
    public record UrlValidation(boolean valid, String url, String reason) {

        static UrlValidation ok(String url) {
            return new UrlValidation(true, url, "");
        }

        static UrlValidation rejected(String reason) {
            return new UrlValidation(false, null, reason);
        }

    }

}
