package ai.palicorpus.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * One JSON object per event. MDC entries are written as top-level fields, so the session scope and current
 * unit appear next to the message.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final Set<String> RESERVED = Set.of("timestamp", "level", "logger", "thread", "message", "exception");

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        appendField(builder, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        builder.append(',');
        appendField(builder, "level", event.getLevel().toString());
        builder.append(',');
        appendField(builder, "logger", event.getLoggerName());
        builder.append(',');
        appendField(builder, "thread", event.getThreadName());
        builder.append(',');
        appendField(builder, "message", event.getFormattedMessage());

        for (Map.Entry<String, String> entry : new TreeMap<>(safeMdc(event)).entrySet()) {
            String key = RESERVED.contains(entry.getKey()) ? "mdc." + entry.getKey() : entry.getKey();
            builder.append(',');
            appendField(builder, key, entry.getValue());
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            builder.append(',');
            appendField(builder, "exception", ThrowableProxyUtil.asString(throwable));
        }

        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private void appendField(StringBuilder builder, String name, String value) {
        builder.append(quote(name)).append(':').append(quote(value));
    }

    private Map<String, String> safeMdc(ILoggingEvent event) {
        Map<String, String> map = event.getMDCPropertyMap();
        return map == null ? Map.of() : map;
    }

    private String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }
}
