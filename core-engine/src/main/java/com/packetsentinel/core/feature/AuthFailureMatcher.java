package com.packetsentinel.core.feature;

import com.packetsentinel.core.model.PacketRecord;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes failed-authentication responses in packet payloads.
 *
 * <p>
 * The signals are server responses (HTTP 401, FTP 530, SMTP 535, textual
 * login failures), so the failure is attributed to the packet's
 * <em>destination</em>, the client that attempted to log in.
 * </p>
 *
 * @since 1.0.0
 */
final class AuthFailureMatcher {

    private static final List<Pattern> SIGNALS = List.of(
            Pattern.compile("^HTTP/\\d(?:\\.\\d)?\\s+401\\b", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
            Pattern.compile("^530[\\s-]", Pattern.MULTILINE),
            Pattern.compile("^535[\\s-]", Pattern.MULTILINE),
            Pattern.compile("login\\s+(?:failed|incorrect)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("authentication\\s+fail(?:ed|ure)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("invalid\\s+(?:password|credentials)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("failed\\s+password", Pattern.CASE_INSENSITIVE),
            Pattern.compile("access\\s+denied", Pattern.CASE_INSENSITIVE));

    private AuthFailureMatcher() {
    }

    static boolean isAuthFailure(PacketRecord packet) {
        if (packet.payloadLength() == 0) {
            return false;
        }
        String text = packet.payloadText();
        for (Pattern signal : SIGNALS) {
            if (signal.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
