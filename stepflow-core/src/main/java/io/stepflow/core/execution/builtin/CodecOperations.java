package io.stepflow.core.execution.builtin;

import io.stepflow.core.exception.StepflowException;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.util.Dates;
import io.stepflow.core.util.JsonUtil;
import io.stepflow.core.util.Values;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/// The `core.*` operations that encode, decode or compute: `crypto`, `datetime`, `parse`,
/// `compress` and `decompress`.
///
/// Digests and ciphers come from the JCA providers of the running JDK. Calendar arithmetic is
/// done in UTC.
final class CodecOperations {

    private static final int GCM_TAG_BYTES = 16;
    private static final int IV_BYTES = 16;
    private static final Pattern XML_ELEMENT =
            Pattern.compile("<(\\w+)(?:\\s[^>]*)?>([^<]*)</\\1>");
    private static final Map<String, Long> UNIT_MILLIS =
            Map.of(
                    "ms", 1L,
                    "seconds", 1_000L,
                    "minutes", 60_000L,
                    "hours", 3_600_000L,
                    "days", 86_400_000L,
                    "weeks", 604_800_000L);

    private static final SecureRandom RANDOM = new SecureRandom();

    private CodecOperations() {}

    static void registerAll(BuiltinOperations registry, Clock clock) {
        registry.register("core.crypto", CodecOperations::crypto);
        registry.register("core.datetime", op -> datetime(op, clock));
        registry.register("core.parse", CodecOperations::parse);
        registry.register("core.compress", CodecOperations::compress);
        registry.register("core.decompress", CodecOperations::decompress);
    }

    // --- crypto ---

    private static Object crypto(OperationContext op) {
        String operation = Values.stringify(op.input("operation"));
        String data = Values.stringify(op.input("data"));
        String encoding = Values.stringify(op.input("encoding", "hex"));
        try {
            return switch (operation) {
                case "hash" -> {
                    MessageDigest digest =
                            MessageDigest.getInstance(digestName(op.input("algorithm", "sha256")));
                    yield encode(digest.digest(data.getBytes(StandardCharsets.UTF_8)), encoding);
                }
                case "hmac" -> {
                    if (op.input("key") == null) {
                        throw new ValidationException("core.crypto: key required for hmac");
                    }
                    String algorithm =
                            "Hmac" + digestName(op.input("algorithm", "sha256")).replace("-", "");
                    Mac mac = Mac.getInstance(algorithm);
                    mac.init(
                            new SecretKeySpec(
                                    Values.stringify(op.input("key"))
                                            .getBytes(StandardCharsets.UTF_8),
                                    algorithm));
                    yield encode(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)), encoding);
                }
                case "random" -> {
                    byte[] bytes = new byte[Values.toInt(op.input("size"), 32)];
                    RANDOM.nextBytes(bytes);
                    yield encode(bytes, encoding);
                }
                case "encrypt" -> encrypt(op, data);
                case "decrypt" -> decrypt(op);
                default ->
                        throw new ValidationException(
                                "core.crypto: unknown operation \"" + operation + "\"");
            };
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ValidationException("core.crypto: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> encrypt(OperationContext op, String data)
            throws GeneralSecurityException {
        if (op.input("key") == null) {
            throw new ValidationException("core.crypto: key required for encrypt");
        }
        String algorithm = Values.stringify(op.input("algorithm", "aes-256-gcm"));
        byte[] iv = new byte[IV_BYTES];
        RANDOM.nextBytes(iv);
        Cipher cipher = cipher(algorithm, Cipher.ENCRYPT_MODE, key(op), iv);
        byte[] sealed = cipher.doFinal(data.getBytes(StandardCharsets.UTF_8));

        HexFormat hex = HexFormat.of();
        Map<String, Object> result = new LinkedHashMap<>();
        if (isGcm(algorithm)) {
            int split = sealed.length - GCM_TAG_BYTES;
            result.put("encrypted", hex.formatHex(Arrays.copyOfRange(sealed, 0, split)));
            result.put("iv", hex.formatHex(iv));
            result.put("authTag", hex.formatHex(Arrays.copyOfRange(sealed, split, sealed.length)));
        } else {
            result.put("encrypted", hex.formatHex(sealed));
            result.put("iv", hex.formatHex(iv));
            result.put("authTag", "");
        }
        return result;
    }

    private static String decrypt(OperationContext op) throws GeneralSecurityException {
        if (op.input("key") == null || op.input("encrypted") == null || op.input("iv") == null) {
            throw new ValidationException(
                    "core.crypto: key, encrypted, iv required for decrypt");
        }
        String algorithm = Values.stringify(op.input("algorithm", "aes-256-gcm"));
        HexFormat hex = HexFormat.of();
        byte[] iv = hex.parseHex(Values.stringify(op.input("iv")));
        byte[] encrypted = hex.parseHex(Values.stringify(op.input("encrypted")));
        if (isGcm(algorithm)) {
            byte[] tag = hex.parseHex(Values.stringify(op.input("authTag", "")));
            byte[] sealed = Arrays.copyOf(encrypted, encrypted.length + tag.length);
            System.arraycopy(tag, 0, sealed, encrypted.length, tag.length);
            encrypted = sealed;
        }
        Cipher cipher = cipher(algorithm, Cipher.DECRYPT_MODE, key(op), iv);
        return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
    }

    private static SecretKeySpec key(OperationContext op) {
        return new SecretKeySpec(HexFormat.of().parseHex(Values.stringify(op.input("key"))), "AES");
    }

    private static Cipher cipher(String algorithm, int mode, SecretKeySpec key, byte[] iv)
            throws GeneralSecurityException {
        if (isGcm(algorithm)) {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(mode, key, new GCMParameterSpec(GCM_TAG_BYTES * 8, iv));
            return cipher;
        }
        if (algorithm.endsWith("-cbc")) {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(mode, key, new IvParameterSpec(iv));
            return cipher;
        }
        throw new ValidationException("core.crypto: unsupported cipher \"" + algorithm + "\"");
    }

    private static boolean isGcm(String algorithm) {
        return algorithm.endsWith("-gcm");
    }

    private static String digestName(Object algorithm) {
        String name = Values.stringify(algorithm).toLowerCase(Locale.ROOT);
        return switch (name) {
            case "md5" -> "MD5";
            case "sha1" -> "SHA-1";
            case "sha256" -> "SHA-256";
            case "sha384" -> "SHA-384";
            case "sha512" -> "SHA-512";
            default -> name.toUpperCase(Locale.ROOT);
        };
    }

    private static String encode(byte[] bytes, String encoding) {
        return switch (encoding) {
            case "base64" -> Base64.getEncoder().encodeToString(bytes);
            case "hex" -> HexFormat.of().formatHex(bytes);
            default ->
                    throw new ValidationException(
                            "core.crypto: unknown encoding \"" + encoding + "\"");
        };
    }

    // --- datetime ---

    private static Object datetime(OperationContext op, Clock clock) {
        String operation = Values.stringify(op.input("operation"));
        Instant date = clock.instant();
        if (op.input("date") != null) {
            date = Dates.toInstant(op.input("date"));
            if (date == null) {
                throw new ValidationException("Invalid date value: " + op.input("date"));
            }
        }
        ZonedDateTime utc = date.atZone(ZoneOffset.UTC);
        return switch (operation) {
            case "now" -> clock.instant().toString();
            case "parse" -> date.toString();
            case "format" ->
                    switch (Values.stringify(op.input("format", "iso"))) {
                        case "date" -> utc.toLocalDate().toString();
                        case "time" -> utc.toLocalTime().truncatedTo(ChronoUnit.MILLIS).toString();
                        case "unix" -> date.getEpochSecond();
                        case "unix_ms" -> date.toEpochMilli();
                        default -> date.toString();
                    };
            case "add" -> date.plusMillis(shiftMillis(op)).toString();
            case "subtract" -> date.minusMillis(shiftMillis(op)).toString();
            case "diff" -> {
                Instant other = Dates.toInstant(op.input("date2"));
                if (other == null) {
                    throw new ValidationException("Invalid date value: " + op.input("date2"));
                }
                long diff = Duration.between(other, date).toMillis();
                yield Values.normalize((double) diff / unitMillis(op.input("unit", "days")));
            }
            case "start_of" ->
                    switch (Values.stringify(op.input("unit", "day"))) {
                        case "hour" -> utc.truncatedTo(ChronoUnit.HOURS).toInstant().toString();
                        case "month" ->
                                utc.with(TemporalAdjusters.firstDayOfMonth())
                                        .truncatedTo(ChronoUnit.DAYS)
                                        .toInstant()
                                        .toString();
                        case "year" ->
                                utc.with(TemporalAdjusters.firstDayOfYear())
                                        .truncatedTo(ChronoUnit.DAYS)
                                        .toInstant()
                                        .toString();
                        default -> utc.truncatedTo(ChronoUnit.DAYS).toInstant().toString();
                    };
            case "end_of" -> {
                ZonedDateTime start =
                        switch (Values.stringify(op.input("unit", "day"))) {
                            case "month" ->
                                    utc.with(TemporalAdjusters.firstDayOfNextMonth())
                                            .truncatedTo(ChronoUnit.DAYS);
                            case "year" ->
                                    utc.with(TemporalAdjusters.firstDayOfNextYear())
                                            .truncatedTo(ChronoUnit.DAYS);
                            default -> utc.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                        };
                yield start.minus(1, ChronoUnit.MILLIS).toInstant().toString();
            }
            default ->
                    throw new ValidationException(
                            "core.datetime: unknown operation \"" + operation + "\"");
        };
    }

    private static long shiftMillis(OperationContext op) {
        double amount = Values.toDouble(op.input("amount"));
        if (Double.isNaN(amount)) {
            throw new ValidationException("core.datetime: amount must be a number");
        }
        return Math.round(amount * unitMillis(op.input("unit", "days")));
    }

    private static long unitMillis(Object unit) {
        return UNIT_MILLIS.getOrDefault(Values.stringify(unit), UNIT_MILLIS.get("days"));
    }

    // --- parse ---

    private static Object parse(OperationContext op) {
        if (!(op.input("data") instanceof String data)) {
            throw new ValidationException("core.parse: data must be a string");
        }
        if (op.input("format") == null) {
            throw new ValidationException("core.parse: format is required");
        }
        String format = Values.stringify(op.input("format"));
        return switch (format) {
            case "json" -> JsonUtil.parse(data);
            case "yaml" -> JsonUtil.parseYaml(data);
            case "csv" -> parseCsv(data, op);
            case "xml" -> {
                Map<String, Object> elements = new LinkedHashMap<>();
                Matcher matcher = XML_ELEMENT.matcher(data);
                while (matcher.find()) {
                    elements.put(matcher.group(1), matcher.group(2).trim());
                }
                yield elements;
            }
            case "url_params" -> {
                Map<String, Object> params = new LinkedHashMap<>();
                String query = data.startsWith("?") ? data.substring(1) : data;
                for (String pair : query.split("&")) {
                    if (pair.isEmpty()) {
                        continue;
                    }
                    int eq = pair.indexOf('=');
                    String name = eq < 0 ? pair : pair.substring(0, eq);
                    String value = eq < 0 ? "" : pair.substring(eq + 1);
                    params.put(
                            URLDecoder.decode(name, StandardCharsets.UTF_8),
                            URLDecoder.decode(value, StandardCharsets.UTF_8));
                }
                yield params;
            }
            default ->
                    throw new ValidationException("core.parse: unknown format \"" + format + "\"");
        };
    }

    private static Object parseCsv(String data, OperationContext op) {
        String delimiter = Pattern.quote(Values.stringify(op.input("delimiter", ",")));
        boolean header = op.input("header") == null || Values.isTruthy(op.input("header"));
        List<String> lines = new ArrayList<>();
        for (String line : data.split("\\r?\\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        List<Object> rows = new ArrayList<>();
        if (lines.isEmpty()) {
            return rows;
        }
        if (!header) {
            for (String line : lines) {
                rows.add(trimmed(line.split(delimiter, -1)));
            }
            return rows;
        }
        List<String> columns = trimmed(lines.get(0).split(delimiter, -1));
        for (String line : lines.subList(1, lines.size())) {
            String[] cells = line.split(delimiter, -1);
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < cells.length ? cells[i].trim() : "");
            }
            rows.add(row);
        }
        return rows;
    }

    private static List<String> trimmed(String[] cells) {
        List<String> values = new ArrayList<>(cells.length);
        for (String cell : cells) {
            values.add(cell.trim());
        }
        return values;
    }

    // --- compress ---

    private static Object compress(OperationContext op) {
        String data = requireData(op, "core.compress");
        String algorithm = Values.stringify(op.input("algorithm", "gzip"));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = compressor(algorithm, buffer)) {
            out.write(data.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StepflowException("core.compress failed: " + e.getMessage(), e, false);
        }
        return Base64.getEncoder().encodeToString(buffer.toByteArray());
    }

    private static Object decompress(OperationContext op) {
        String data = requireData(op, "core.decompress");
        String algorithm = Values.stringify(op.input("algorithm", "gzip"));
        byte[] compressed;
        try {
            compressed = Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("core.decompress: data is not base64", e);
        }
        try (InputStream in = decompressor(algorithm, new ByteArrayInputStream(compressed))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ValidationException("core.decompress failed: " + e.getMessage(), e);
        }
    }

    private static OutputStream compressor(String algorithm, OutputStream target)
            throws IOException {
        return switch (algorithm) {
            case "gzip" -> new GZIPOutputStream(target);
            case "deflate" -> new DeflaterOutputStream(target);
            default ->
                    throw new ValidationException(
                            "core.compress: unknown algorithm \"" + algorithm + "\"");
        };
    }

    private static InputStream decompressor(String algorithm, InputStream source)
            throws IOException {
        return switch (algorithm) {
            case "gzip" -> new GZIPInputStream(source);
            case "deflate" -> new InflaterInputStream(source);
            default ->
                    throw new ValidationException(
                            "core.decompress: unknown algorithm \"" + algorithm + "\"");
        };
    }

    private static String requireData(OperationContext op, String operation) {
        Object data = op.input("data");
        if (data == null || Values.stringify(data).isEmpty()) {
            throw new ValidationException(operation + ": data is required");
        }
        return Values.stringify(data);
    }
}
