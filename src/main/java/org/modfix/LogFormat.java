package org.modfix;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/** One line per record: time, level, thread id and message, followed by the stack trace if there is one. */
class LogFormat extends Formatter {
    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    @Override
    public String format(LogRecord record) {
        var line = new StringBuilder();
        line.append(TIME.format(Instant.ofEpochMilli(record.getMillis())))
                .append('\t')
                .append(record.getLevel().getName())
                .append('\t')
                .append(record.getLongThreadID())
                .append('\t')
                .append(formatMessage(record))
                .append(System.lineSeparator());
        if (record.getThrown() != null) {
            var trace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(trace));
            line.append(trace);
        }
        return line.toString();
    }
}
