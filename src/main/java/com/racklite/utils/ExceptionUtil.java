package com.racklite.utils;

import com.racklite.core.DiscoveryException;

import io.vertx.core.eventbus.Message;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * ExceptionUtil - Generic Exception Handling Utility

 * Provides consistent error handling for event bus consumers:
 * - Failure code mapping per DiscoveryException kind
 * - Message text combining operation context with the failure detail
 * - message.fail() replies
 */
public class ExceptionUtil
{

    private static final Logger logger = LoggerFactory.getLogger(ExceptionUtil.class);

    public static final int BAD_REQUEST = 400;

    public static final int NOT_FOUND = 404;

    public static final int CONFLICT = 409;

    public static final int UNPROCESSABLE = 422;

    public static final int INTERNAL_ERROR = 500;

    private ExceptionUtil()
    {
    }

    /**
     * Reply to an event bus message with a failure
     *
     * @param message Message to reply to
     * @param cause Exception cause
     * @param defaultMessage Context for the failure text
     */
    public static void handleEventBus(Message<?> message, Throwable cause, String defaultMessage)
    {
        var code = failureCode(cause);

        var text = getMessage(cause, defaultMessage);

        if (code >= INTERNAL_ERROR)
        {
            logger.error("Event bus error [{}]: {}", message.address(), text);
        }
        else
        {
            logger.debug("Event bus request rejected [{}] {}: {}", message.address(), code, text);
        }

        message.fail(code, text);
    }

    /**
     * Map a failure to a stable reply code
     *
     * @param cause Exception cause
     * @return failure code
     */
    public static int failureCode(Throwable cause)
    {
        if (!(cause instanceof DiscoveryException))
        {
            return cause instanceof IllegalArgumentException ? BAD_REQUEST : INTERNAL_ERROR;
        }

        switch (((DiscoveryException) cause).kind())
        {
            case NOT_FOUND:
                return NOT_FOUND;

            case ALREADY_PROMOTED:
                return CONFLICT;

            case INVALID_REQUEST:
                return BAD_REQUEST;

            case INVALID_REFERENCE:
            case CONFIGURATION:
                return UNPROCESSABLE;

            case CANCELLED:
                return CONFLICT;

            default:
                return INTERNAL_ERROR;
        }
    }

    /**
     * Extract meaningful error message from exception
     * Combines default message (context) with exception message (specific error) when both are available
     *
     * @param cause Exception cause
     * @param defaultMessage Default message providing context
     * @return Error message (combined or default only)
     */
    static String getMessage(Throwable cause, String defaultMessage)
    {
        if (cause == null)
        {
            return defaultMessage;
        }

        var exceptionMessage = cause.getMessage();

        if (exceptionMessage != null && !exceptionMessage.trim().isEmpty())
        {
            return defaultMessage + ": " + exceptionMessage;
        }

        return defaultMessage;
    }

}
