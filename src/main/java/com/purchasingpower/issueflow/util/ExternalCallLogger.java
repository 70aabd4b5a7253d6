package com.purchasingpower.issueflow.util;

import com.purchasingpower.issueflow.model.CallContext;
import com.purchasingpower.issueflow.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls to GitHub, the inference service and git remotes.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
