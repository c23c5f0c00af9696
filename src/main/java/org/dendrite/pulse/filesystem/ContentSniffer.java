package org.dendrite.pulse.filesystem;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 基于文件头签名的内容类型探测（最多读取前 512 字节）。
 * <p>
 * 判定顺序：HTML/XML 标记、各类二进制签名、BOM；都不命中时，不含控制字节的内容视为 UTF-8 文本，否则为
 * {@code application/octet-stream}。
 */
public class ContentSniffer {

    public static final int SNIFF_LENGTH = 512;

    static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    static final String OCTET_STREAM = "application/octet-stream";

    private static final List<String> HTML_TAGS = List.of(
            "<!DOCTYPE HTML", "<HTML", "<HEAD", "<SCRIPT", "<IFRAME", "<H1", "<DIV", "<FONT",
            "<TABLE", "<A", "<STYLE", "<TITLE", "<B", "<BODY", "<BR", "<P", "<!--"
    );

    private static final List<Signature> SIGNATURES = List.of(
            Signature.prefix("%PDF-", "application/pdf"),
            Signature.prefix("%!PS-Adobe-", "application/postscript"),
            Signature.bytes(new int[]{0xFE, 0xFF}, "text/plain; charset=utf-16be"),
            Signature.bytes(new int[]{0xFF, 0xFE}, "text/plain; charset=utf-16le"),
            Signature.bytes(new int[]{0xEF, 0xBB, 0xBF}, TEXT_PLAIN),
            Signature.bytes(new int[]{0x00, 0x00, 0x01, 0x00}, "image/x-icon"),
            Signature.bytes(new int[]{0x00, 0x00, 0x02, 0x00}, "image/x-icon"),
            Signature.prefix("BM", "image/bmp"),
            Signature.prefix("GIF87a", "image/gif"),
            Signature.prefix("GIF89a", "image/gif"),
            Signature.bytes(new int[]{0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}, "image/png"),
            Signature.bytes(new int[]{0xFF, 0xD8, 0xFF}, "image/jpeg"),
            Signature.masked("RIFF\0\0\0\0WEBPVP", "FFFFFFFF00000000FFFFFFFFFFFF", "image/webp"),
            Signature.masked("FORM\0\0\0\0AIFF", "FFFFFFFF00000000FFFFFFFF", "audio/aiff"),
            Signature.prefix("ID3", "audio/mpeg"),
            Signature.prefix("OggS\0", "application/ogg"),
            Signature.prefix("MThd\0\0\0\6", "audio/midi"),
            Signature.masked("RIFF\0\0\0\0AVI ", "FFFFFFFF00000000FFFFFFFF", "video/avi"),
            Signature.masked("RIFF\0\0\0\0WAVE", "FFFFFFFF00000000FFFFFFFF", "audio/wave"),
            Signature.bytes(new int[]{0x1A, 0x45, 0xDF, 0xA3}, "video/webm"),
            Signature.prefix("wOFF", "font/woff"),
            Signature.prefix("wOF2", "font/woff2"),
            Signature.bytes(new int[]{0x00, 0x01, 0x00, 0x00}, "font/ttf"),
            Signature.prefix("OTTO", "font/otf"),
            Signature.prefix("ttcf", "font/collection"),
            Signature.bytes(new int[]{0x1F, 0x8B, 0x08}, "application/x-gzip"),
            Signature.prefix("PK\3\4", "application/zip"),
            Signature.prefix("Rar!\032\007\0", "application/x-rar-compressed"),
            Signature.prefix("Rar!\032\007\1\0", "application/x-rar-compressed"),
            Signature.bytes(new int[]{0x00, 0x61, 0x73, 0x6D}, "application/wasm")
    );

    /**
     * 探测文件内容类型；打开或读取失败时返回空字符串。
     */
    public String sniff(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return detect(in.readNBytes(SNIFF_LENGTH));
        } catch (IOException e) {
            return "";
        }
    }

    public String detect(byte[] data) {
        int length = Math.min(data.length, SNIFF_LENGTH);

        int first = firstNonWhitespace(data, length);
        if (isHtml(data, first, length)) {
            return "text/html; charset=utf-8";
        }
        if (startsWith(data, first, length, "<?xml")) {
            return "text/xml; charset=utf-8";
        }
        for (Signature signature : SIGNATURES) {
            if (signature.matches(data, length)) {
                return signature.contentType();
            }
        }
        if (isMp4(data, length)) {
            return "video/mp4";
        }
        for (int i = 0; i < length; i++) {
            if (isBinaryByte(data[i] & 0xFF)) {
                return OCTET_STREAM;
            }
        }
        return TEXT_PLAIN;
    }

    private static boolean isHtml(byte[] data, int from, int length) {
        for (String tag : HTML_TAGS) {
            int end = from + tag.length();
            if (end >= length) {
                continue;
            }
            String head = new String(data, from, tag.length(), StandardCharsets.ISO_8859_1);
            if (!head.toUpperCase(Locale.ROOT).equals(tag)) {
                continue;
            }
            // 标签后必须紧跟空格或 >
            int terminator = data[end] & 0xFF;
            if (terminator == ' ' || terminator == '>') {
                return true;
            }
        }
        return false;
    }

    private static boolean isMp4(byte[] data, int length) {
        if (length < 12) {
            return false;
        }
        int boxSize = ((data[0] & 0xFF) << 24) | ((data[1] & 0xFF) << 16) | ((data[2] & 0xFF) << 8) | (data[3] & 0xFF);
        if (boxSize < 12 || boxSize % 4 != 0 || length < boxSize) {
            return false;
        }
        if (!startsWith(data, 4, length, "ftyp")) {
            return false;
        }
        for (int i = 8; i + 3 <= boxSize; i += 4) {
            if (i == 12) {
                // 跳过 minor version
                continue;
            }
            if (startsWith(data, i, length, "mp4")) {
                return true;
            }
        }
        return false;
    }

    private static int firstNonWhitespace(byte[] data, int length) {
        int i = 0;
        while (i < length) {
            int b = data[i] & 0xFF;
            if (b != '\t' && b != '\n' && b != 0x0C && b != '\r' && b != ' ') {
                break;
            }
            i++;
        }
        return i;
    }

    private static boolean startsWith(byte[] data, int from, int length, String prefix) {
        if (from + prefix.length() > length) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if ((data[from + i] & 0xFF) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBinaryByte(int b) {
        return b <= 0x08 || b == 0x0B || (b >= 0x0E && b <= 0x1A) || (b >= 0x1C && b <= 0x1F);
    }

    private record Signature(int[] pattern, int[] mask, String contentType) {

        static Signature prefix(String text, String contentType) {
            int[] pattern = new int[text.length()];
            for (int i = 0; i < text.length(); i++) {
                pattern[i] = text.charAt(i) & 0xFF;
            }
            return bytes(pattern, contentType);
        }

        static Signature bytes(int[] pattern, String contentType) {
            int[] mask = new int[pattern.length];
            Arrays.fill(mask, 0xFF);
            return new Signature(pattern, mask, contentType);
        }

        static Signature masked(String text, String hexMask, String contentType) {
            int[] pattern = prefix(text, contentType).pattern();
            int[] mask = new int[hexMask.length() / 2];
            for (int i = 0; i < mask.length; i++) {
                mask[i] = Integer.parseInt(hexMask.substring(i * 2, i * 2 + 2), 16);
            }
            return new Signature(pattern, mask, contentType);
        }

        boolean matches(byte[] data, int length) {
            if (length < pattern.length) {
                return false;
            }
            for (int i = 0; i < pattern.length; i++) {
                if (((data[i] & 0xFF) & mask[i]) != pattern[i]) {
                    return false;
                }
            }
            return true;
        }
    }
}
