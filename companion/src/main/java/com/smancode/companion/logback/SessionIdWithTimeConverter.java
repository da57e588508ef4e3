package com.smancode.companion.logback;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Logback 转换器：思考会话 ID + 事件时间
 * <p>
 * 输出 sessionId_HHmmss，不在会话线程上时输出 -_HHmmss。
 * 时间取自日志事件本身。
 */
public class SessionIdWithTimeConverter extends ClassicConverter {

    static final String MDC_KEY = "sessionId";

    private static final DateTimeFormatter TIME_FORMATTER =
            DateTimeFormatter.ofPattern("HHmmss").withZone(ZoneId.systemDefault());

    @Override
    public String convert(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap();
        String sessionId = mdc != null ? mdc.get(MDC_KEY) : null;
        String time = TIME_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()));

        if (sessionId == null || sessionId.isEmpty()) {
            return "-_" + time;
        }
        return sessionId + "_" + time;
    }
}
