package io.agentbus.handler.responder;

import java.util.Locale;

/**
 * Default responder: picks a canned answer by keyword category, echoing the query otherwise.
 */
public final class KeywordResponder implements Responder {

    @Override
    public String respond(final String text) {
        final String query = text == null ? "" : text;

        return switch (classify(query)) {
            case WEATHER -> "Weather Update: I understand you're asking about the weather. "
                    + "For real-time weather information I'd need to access current weather APIs. "
                    + "However, I can help you set up weather data processing or analysis if you have weather data!";
            case DATA_ANALYSIS -> "Data Analysis Ready: I can help you with various data analysis tasks including:\n"
                    + "- Statistical analysis and hypothesis testing\n"
                    + "- Data visualization and dashboard creation\n"
                    + "- Predictive modeling and machine learning\n"
                    + "- Trend analysis and forecasting\n"
                    + "- Data cleaning and preprocessing\n\n"
                    + "What specific type of data are you working with?";
            case CODING -> "Coding Assistant: I can help you with programming tasks including:\n"
                    + "- Code review and optimization\n"
                    + "- Debugging and troubleshooting\n"
                    + "- API development and integration\n"
                    + "- Database design and queries\n"
                    + "- Best practices and architecture\n\n"
                    + "Share your specific coding challenge!";
            case SYSTEM_STATUS -> "System Status: Multi-agent system is running optimally!\n"
                    + "- Message broker: Active\n"
                    + "- Query handler: Processing\n"
                    + "- All systems operational";
            case GENERAL -> "Query Processed: I received and analyzed your query: '" + query + "'\n\n"
                    + "The multi-agent system has processed your request. For more specific assistance, try asking about:\n"
                    + "- Weather information\n"
                    + "- Data analysis tasks\n"
                    + "- Programming help\n"
                    + "- System status\n\n"
                    + "How else can I help you today?";
        };
    }

    /**
     * Lower-cases and trims the query and strips a single leading command prefix ({@code <}, {@code >} or {@code /}).
     */
    public ResponseCategory classify(final String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT).strip();
        if (!normalized.isEmpty() && "<>/".indexOf(normalized.charAt(0)) >= 0) {
            normalized = normalized.substring(1).strip();
        }

        for (final ResponseCategory c : ResponseCategory.values()) {
            if (c.matches(normalized)) return c;
        }
        return ResponseCategory.GENERAL;
    }
}
