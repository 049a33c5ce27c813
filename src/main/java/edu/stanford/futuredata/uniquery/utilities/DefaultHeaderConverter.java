package edu.stanford.futuredata.uniquery.utilities;

import edu.stanford.futuredata.uniquery.interfaces.HeaderConverter;
import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.QueryHeaders;
import edu.stanford.futuredata.uniquery.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

public class DefaultHeaderConverter implements HeaderConverter {
    private static final Logger logger = LoggerFactory.getLogger(DefaultHeaderConverter.class);

    public static final String CONTINUATION = "x-ms-continuation";
    public static final String REQUEST_CHARGE = "x-ms-request-charge";
    public static final String ACTIVITY_ID = "x-ms-activity-id";
    public static final String SESSION_TOKEN = "x-ms-session-token";
    public static final String ITEM_COUNT = "x-ms-item-count";
    public static final String SUB_STATUS = "x-ms-substatus";
    public static final String RETRY_AFTER_MS = "x-ms-retry-after-ms";

    @Override
    public QueryHeaders convert(Map<String, String> rawHeaders, ResourceKind resourceKind,
                                CollectionIdentity collectionIdentity) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (rawHeaders != null) {
            // Status lines show up under a null key.
            rawHeaders.forEach((name, value) -> {
                if (name != null) {
                    headers.put(name, value);
                }
            });
        }
        String continuation = headers.get(CONTINUATION);
        if (continuation != null && continuation.isEmpty()) {
            continuation = null;
        }
        return new QueryHeaders(
                resourceKind,
                collectionIdentity,
                continuation,
                parseDouble(headers, REQUEST_CHARGE),
                headers.get(ACTIVITY_ID),
                headers.get(SESSION_TOKEN),
                parseInt(headers, ITEM_COUNT, null),
                parseInt(headers, SUB_STATUS, 0),
                parseLong(headers, RETRY_AFTER_MS, 0L),
                headers);
    }

    private static double parseDouble(Map<String, String> headers, String name) {
        String value = headers.get(name);
        if (value == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed header {}: {}", name, value);
            return 0.0;
        }
    }

    // Values outside the int range count as malformed.
    private static Integer parseInt(Map<String, String> headers, String name, Integer defaultValue) {
        String value = headers.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed header {}: {}", name, value);
            return defaultValue;
        }
    }

    private static Long parseLong(Map<String, String> headers, String name, Long defaultValue) {
        String value = headers.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed header {}: {}", name, value);
            return defaultValue;
        }
    }
}
