package com.logvault.application.usecase;

import com.logvault.domain.ContentHash;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tells first-seen records from repeats within one import run.
 * <p>
 * Records are identified by the MD5 digest of their UTF-8 bytes. Two different lines with the same
 * digest would be treated as one; at 128 bits that risk is accepted. The seen set lives only as
 * long as this instance and never looks at what the store already holds, so importing the same
 * file twice stores every line twice.
 */
public class Deduplicator {

    private final Set<ContentHash> seen = new HashSet<>();
    private final MessageDigest md5 = md5Digest();

    public boolean isDuplicate(String record) {
        byte[] digest = md5.digest(record.getBytes(StandardCharsets.UTF_8));
        return !seen.add(ContentHash.of(digest));
    }

    public List<String> filter(List<String> records) {
        List<String> unique = new ArrayList<>(records.size());
        for (String record : records) {
            if (!isDuplicate(record)) {
                unique.add(record);
            }
        }
        return unique;
    }

    public int seenCount() {
        return seen.size();
    }

    private static MessageDigest md5Digest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 MessageDigest is not available in this runtime", e);
        }
    }
}
