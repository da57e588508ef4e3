package com.smancode.companion.util;

/**
 * 异常堆栈格式化
 * <p>
 * 思考会话的失败日志只占一行，格式：类型: 消息 &lt;- 帧 &lt;- 帧 ... [Caused by: ...]
 */
public final class StackTraceUtils {

    private static final String SEPARATOR = " <- ";

    /**
     * 每一层异常最多保留的帧数
     */
    static final int MAX_FRAMES = 8;

    /**
     * cause 链最大深度
     */
    static final int MAX_CAUSE_DEPTH = 4;

    private StackTraceUtils() {
    }

    /**
     * 异常转单行字符串，null 返回空串
     */
    public static String formatStackTrace(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendThrowable(sb, throwable, 0);
        return sb.toString();
    }

    /**
     * 只取异常链最底层的消息，用于返回给客户端的错误提示
     */
    public static String rootCauseMessage(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        Throwable root = throwable;
        int depth = 0;
        while (root.getCause() != null && root.getCause() != root && depth < MAX_CAUSE_DEPTH) {
            root = root.getCause();
            depth++;
        }
        String message = root.getMessage();
        return message != null && !message.isEmpty() ? message : root.getClass().getSimpleName();
    }

    private static void appendThrowable(StringBuilder sb, Throwable throwable, int depth) {
        sb.append(throwable.getClass().getSimpleName());
        String message = throwable.getMessage();
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message.replace('\n', ' '));
        }

        StackTraceElement[] frames = throwable.getStackTrace();
        int shown = Math.min(frames.length, MAX_FRAMES);
        for (int i = 0; i < shown; i++) {
            sb.append(SEPARATOR).append(frames[i]);
        }
        if (frames.length > shown) {
            sb.append(SEPARATOR).append("...");
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            if (depth + 1 >= MAX_CAUSE_DEPTH) {
                sb.append(" [Caused by: ...]");
                return;
            }
            sb.append(" [Caused by: ");
            appendThrowable(sb, cause, depth + 1);
            sb.append("]");
        }
    }
}
