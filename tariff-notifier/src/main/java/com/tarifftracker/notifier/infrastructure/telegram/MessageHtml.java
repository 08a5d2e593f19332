package com.tarifftracker.notifier.infrastructure.telegram;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.telegram.telegrambots.meta.api.objects.EntityType;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the HTML source of a received message from its plain text and formatting entities, so
 * that an edit keeps the original bold, underline and code spans. Entity offsets are UTF-16 based,
 * which matches {@link String} indexing.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class MessageHtml {

    private static final Map<String, String> TAGS = Map.of(
            EntityType.BOLD, "b",
            EntityType.ITALIC, "i",
            EntityType.UNDERLINE, "u",
            EntityType.STRIKETHROUGH, "s",
            EntityType.CODE, "code",
            EntityType.PRE, "pre");

    public static String render(Message message) {
        if (message == null || message.getText() == null) {
            return "";
        }
        var text = message.getText();
        var entities = message.getEntities() == null ? List.<MessageEntity>of() : message.getEntities();

        var marks = new ArrayList<Mark>();
        for (int i = 0; i < entities.size(); i++) {
            var entity = entities.get(i);
            var open = openTag(entity);
            if (open == null || entity.getOffset() == null || entity.getLength() == null) {
                continue;
            }
            var start = Math.max(0, Math.min(entity.getOffset(), text.length()));
            var end = Math.max(start, Math.min(entity.getOffset() + entity.getLength(), text.length()));
            if (end == start) {
                continue;
            }
            marks.add(new Mark(start, false, end - start, i, open));
            marks.add(new Mark(end, true, end - start, i, closeTag(entity)));
        }
        marks.sort(Mark.ORDER);

        var html = new StringBuilder(text.length() + marks.size() * 8);
        int cursor = 0;
        for (var mark : marks) {
            escape(text, cursor, mark.position(), html);
            html.append(mark.tag());
            cursor = mark.position();
        }
        escape(text, cursor, text.length(), html);
        return html.toString();
    }

    private static String openTag(MessageEntity entity) {
        if (entity.getType() == null) {
            return null;
        }
        if (EntityType.TEXTLINK.equals(entity.getType()) && entity.getUrl() != null) {
            return "<a href=\"" + escapeAttribute(entity.getUrl()) + "\">";
        }
        var tag = TAGS.get(entity.getType());
        return tag == null ? null : "<" + tag + ">";
    }

    private static String closeTag(MessageEntity entity) {
        if (EntityType.TEXTLINK.equals(entity.getType())) {
            return "</a>";
        }
        return "</" + TAGS.get(entity.getType()) + ">";
    }

    private static void escape(String text, int from, int to, StringBuilder out) {
        for (int i = from; i < to; i++) {
            var c = text.charAt(i);
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                default -> out.append(c);
            }
        }
    }

    private static String escapeAttribute(String value) {
        var out = new StringBuilder(value.length());
        escape(value, 0, value.length(), out);
        return out.toString().replace("\"", "&quot;");
    }

    /**
     * At the same position closing tags come first, inner spans closing before outer ones and outer
     * spans opening before inner ones.
     */
    private record Mark(int position, boolean closing, int span, int index, String tag) {

        static final Comparator<Mark> ORDER = Comparator
                .comparingInt(Mark::position)
                .thenComparing(Mark::closing, Comparator.reverseOrder())
                .thenComparing((a, b) -> a.closing()
                        ? compareClosing(a, b)
                        : compareOpening(a, b));

        private static int compareClosing(Mark a, Mark b) {
            var bySpan = Integer.compare(a.span(), b.span());
            return bySpan != 0 ? bySpan : Integer.compare(b.index(), a.index());
        }

        private static int compareOpening(Mark a, Mark b) {
            var bySpan = Integer.compare(b.span(), a.span());
            return bySpan != 0 ? bySpan : Integer.compare(a.index(), b.index());
        }
    }
}
