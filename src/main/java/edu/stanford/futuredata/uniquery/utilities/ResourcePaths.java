package edu.stanford.futuredata.uniquery.utilities;

import java.nio.ByteBuffer;
import java.util.Base64;

/**
 * Collection paths come in two forms: name-based ({@code dbs/orders/colls/2024}) and identity-based, where both
 * segments are resource ids ({@code dbs/QhdRAA==/colls/QhdRAPjZ8gA=}).
 */
public class ResourcePaths {
    private static final String DATABASES = "dbs";
    private static final String COLLECTIONS = "colls";

    private static final int DATABASE_ID_BYTES = 4;
    private static final int COLLECTION_ID_BYTES = 8;

    public static boolean isNameBased(String path) {
        if (path == null) {
            return false;
        }
        String[] segments = trimSlashes(path).split("/");
        if (segments.length < 2 || !segments[0].equals(DATABASES)) {
            return true;
        }
        byte[] databaseId = decodeResourceId(segments[1]);
        if (databaseId == null || databaseId.length != DATABASE_ID_BYTES) {
            return true;
        }
        if (segments.length < 4) {
            return false;
        }
        if (!segments[2].equals(COLLECTIONS)) {
            return true;
        }
        byte[] collectionId = decodeResourceId(segments[3]);
        if (collectionId == null || collectionId.length != COLLECTION_ID_BYTES) {
            return true;
        }
        // A collection id embeds its database id.
        return ByteBuffer.wrap(collectionId, 0, DATABASE_ID_BYTES).compareTo(ByteBuffer.wrap(databaseId)) != 0;
    }

    // Returns null if the segment is not a resource id.
    static byte[] decodeResourceId(String segment) {
        if (segment.isEmpty()) {
            return null;
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(segment.replace('-', '/'));
        } catch (IllegalArgumentException e) {
            return null;
        }
        // Names like "orders" also decode; only the canonical padded encoding is an id.
        String canonical = Base64.getEncoder().encodeToString(decoded).replace('/', '-');
        return canonical.equals(segment) ? decoded : null;
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') start++;
        while (end > start && path.charAt(end - 1) == '/') end--;
        return path.substring(start, end);
    }
}
