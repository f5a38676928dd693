package com.chicu.ecorisk.ai.ml.features;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;

/**
 * Упорядоченный набор имён фич + hash.
 * Hash сохраняется вместе с моделью: модель обученная под другой набор фич не используется.
 */
public class FeatureSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String[] names;
    private final String schemaHash;

    public FeatureSchema(String[] names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("schema names пустые");
        }
        this.names = names.clone();
        this.schemaHash = sha256(String.join("|", this.names));
    }

    public FeatureSchema(List<String> names) {
        this(names != null ? names.toArray(new String[0]) : null);
    }

    public String[] featureNames() {
        return names.clone();
    }

    public String name(int index) {
        return names[index];
    }

    public int size() {
        return names.length;
    }

    public String schemaHash() {
        return schemaHash;
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
