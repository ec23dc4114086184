package com.chainexplorer.ingestion.adapter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.PrettyPrinter;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.NullNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives block and transaction identifiers when the node payload does not carry them:
 * SHA-256 hex over the JSON of selected fields, keys sorted, in the node's canonical text form
 * ({@code ", "} and {@code ": "} separators, everything outside printable ASCII as a lowercase {@code \}{@code uXXXX} escape).
 */
public final class BlockHashing {

    static final List<String> BLOCK_FIELDS = List.of("height", "prev_hash", "timestamp", "tx_root", "state_root");
    static final List<String> TX_FIELDS = List.of("tx_type", "from_address", "to_address", "amount", "nonce", "signature");

    private final ObjectWriter canonicalWriter;

    public BlockHashing(ObjectMapper objectMapper) {
        this.canonicalWriter = objectMapper.writer()
                .with(new SpacedSeparators())
                .with(new AsciiOnlyEscapes());
    }

    public String blockHash(JsonNode header) {
        return digest(header, BLOCK_FIELDS);
    }

    public String transactionHash(JsonNode tx) {
        return digest(tx, TX_FIELDS);
    }

    String canonicalJson(JsonNode source, List<String> fields) {
        Map<String, JsonNode> canonical = new TreeMap<>();
        for (String field : fields) {
            JsonNode value = source.get(field);
            canonical.put(field, value != null ? value : NullNode.getInstance());
        }
        try {
            return canonicalWriter.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + fields, e);
        }
    }

    private String digest(JsonNode source, List<String> fields) {
        byte[] json = canonicalJson(source, fields).getBytes(StandardCharsets.US_ASCII);
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Single line, {@code ", "} between entries and {@code ": "} after keys. */
    private static final class SpacedSeparators implements PrettyPrinter {

        @Override
        public void writeRootValueSeparator(JsonGenerator g) {
        }

        @Override
        public void writeStartObject(JsonGenerator g) throws IOException {
            g.writeRaw('{');
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            g.writeRaw('}');
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeStartArray(JsonGenerator g) throws IOException {
            g.writeRaw('[');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            g.writeRaw(']');
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void beforeArrayValues(JsonGenerator g) {
        }

        @Override
        public void beforeObjectEntries(JsonGenerator g) {
        }
    }

    /**
     * Escapes control characters, DEL and all non-ASCII characters as lowercase {@code \}{@code uXXXX}; supplementary
     * characters come out as two escaped surrogates. Quote, backslash and the short forms (\n, \t, ...) stay standard.
     */
    private static final class AsciiOnlyEscapes extends CharacterEscapes {

        private final int[] asciiEscapes;

        AsciiOnlyEscapes() {
            int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int c = 0; c < escapes.length; c++) {
                if (escapes[c] == CharacterEscapes.ESCAPE_STANDARD) {
                    escapes[c] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
            escapes[0x7F] = CharacterEscapes.ESCAPE_CUSTOM;
            this.asciiEscapes = escapes;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch < 0x20 || ch >= 0x7F) {
                return new SerializedString(String.format(Locale.ROOT, "\\u%04x", ch));
            }
            return null;
        }
    }
}
