package me.golemcore.biblebot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.biblebot.domain.model.OutgoingMessage;
import me.golemcore.biblebot.domain.model.Passage;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders passages and error texts as room messages.
 *
 * <p>
 * A reply reads {@code <text> - <reference><suffix>}. When it would exceed the
 * maximum message length the reference is shortened first (it must leave room
 * for at least the fallback text), then the passage is cut and {@code ...}
 * appended; if nothing of the passage fits the text becomes the fallback. With
 * splitting enabled, long passages are wrapped on word boundaries into several
 * messages and only the last one carries the reference and suffix.
 */
@Component
public class ReplyFormatter {

    static final String TRUNCATION_INDICATOR = "...";
    static final String REFERENCE_SEPARATOR = " - ";
    static final int MIN_PRACTICAL_CHUNK_SIZE = 8;

    private final BotProperties.ReplyProperties reply;
    private final MessageService messageService;

    public ReplyFormatter(BotProperties properties, MessageService messageService) {
        this.reply = properties.getBible().getReply();
        this.messageService = messageService;
    }

    /**
     * Messages to send for a passage, in order. Empty when the passage text is
     * blank after whitespace normalization.
     */
    public List<OutgoingMessage> formatPassage(Passage passage) {
        String text = normalize(passage.text());
        if (text.isEmpty()) {
            return List.of();
        }
        String reference = passage.reference();
        int maxLength = reply.getMaxMessageLength();
        int splitLength = reply.getSplitMessageLength();

        if (splitLength > 0 && text.length() > splitLength) {
            String trimmedReference = trimReference(reference, 1);
            int suffixLength = suffixFor(trimmedReference).length();
            int chunkLimit = Math.min(splitLength, maxLength);
            int lastChunkLimit = Math.max(1, Math.min(splitLength, maxLength - suffixLength));

            if (lastChunkLimit >= MIN_PRACTICAL_CHUNK_SIZE) {
                List<String> chunks = wrap(text, chunkLimit);
                if (!chunks.isEmpty() && chunks.get(chunks.size() - 1).length() > lastChunkLimit) {
                    String tail = chunks.remove(chunks.size() - 1);
                    chunks.addAll(wrap(tail, lastChunkLimit));
                }
                return toMessages(chunks, trimmedReference);
            }
        }

        String fallback = messageService.getMessage("reply.too_long");
        String trimmedReference = trimReference(reference, fallback.length());
        String suffix = suffixFor(trimmedReference);
        String messageText = text;
        if (text.length() + suffix.length() > maxLength) {
            int maxTextLength = maxLength - suffix.length() - TRUNCATION_INDICATOR.length();
            messageText = maxTextLength > 0
                    ? cut(text, maxTextLength) + TRUNCATION_INDICATOR
                    : fallback;
        }
        return toMessages(new ArrayList<>(List.of(messageText)), trimmedReference);
    }

    /**
     * Plain message with an escaped HTML twin, used for error replies.
     */
    public OutgoingMessage formatNotice(String text) {
        return new OutgoingMessage(text, escapeHtml(text));
    }

    /**
     * Collapses all whitespace to single spaces, or in poetry mode keeps line
     * breaks (at most one blank line in a row) and collapses spaces and tabs.
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        if (reply.isPreservePoetryFormatting()) {
            return text.replaceAll("[ \\t]+", " ")
                    .replaceAll("\\n\\s*\\n", "\n\n")
                    .strip();
        }
        return text.replaceAll("\\s+", " ").strip();
    }

    private List<OutgoingMessage> toMessages(List<String> parts, String reference) {
        List<OutgoingMessage> messages = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            String plain = normalize(parts.get(i));
            String html = toHtml(plain);
            if (i == parts.size() - 1) {
                if (reference != null) {
                    plain = plain + REFERENCE_SEPARATOR + reference + reply.getSuffix();
                    html = html + REFERENCE_SEPARATOR + escapeHtml(reference) + escapeHtml(reply.getSuffix());
                } else {
                    plain = plain + reply.getSuffix();
                    html = html + escapeHtml(reply.getSuffix());
                }
            }
            messages.add(new OutgoingMessage(plain, html));
        }
        return messages;
    }

    /**
     * Shortens the reference so that separator, suffix and
     * {@code reservedTextLength} characters of text still fit. Returns
     * {@code null} when no useful part of the reference fits.
     */
    String trimReference(String reference, int reservedTextLength) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        int budget = reply.getMaxMessageLength() - reply.getSuffix().length()
                - REFERENCE_SEPARATOR.length() - reservedTextLength;
        if (budget <= 0) {
            return null;
        }
        if (reference.length() <= budget) {
            return reference;
        }
        int keep = budget - TRUNCATION_INDICATOR.length();
        return keep > 0 ? cut(reference, keep) + TRUNCATION_INDICATOR : null;
    }

    private String suffixFor(String reference) {
        return reference != null
                ? REFERENCE_SEPARATOR + reference + reply.getSuffix()
                : reply.getSuffix();
    }

    /**
     * Greedy word wrap; words longer than {@code width} are broken.
     */
    static List<String> wrap(String text, int width) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : text.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            while (word.length() > width) {
                if (line.length() > 0) {
                    lines.add(line.toString());
                    line.setLength(0);
                }
                String piece = cut(word, width);
                if (piece.isEmpty()) {
                    piece = word.substring(0, 2);
                }
                lines.add(piece);
                word = word.substring(piece.length());
            }
            if (line.length() == 0) {
                line.append(word);
            } else if (line.length() + 1 + word.length() <= width) {
                line.append(' ').append(word);
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(word);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }

    private static String cut(String text, int length) {
        int end = Math.min(length, text.length());
        if (end > 0 && end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private String toHtml(String plain) {
        String escaped = escapeHtml(plain);
        return reply.isPreservePoetryFormatting() ? escaped.replace("\n", "<br />") : escaped;
    }

    private static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#x27;");
    }
}
