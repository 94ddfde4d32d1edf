package com.lumen.shell;

import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.shell.jline.PromptProvider;

/**
 * Customizes the Spring Shell prompt.
 * <p>
 * The prompt reads "{@code lumen > }" in bright cyan and, while a session is selected,
 * shows the first characters of its id: "{@code lumen [3f2a9c1e] > }".
 * </p>
 */
@Configuration(proxyBeanMethods = false)
public class ShellPromptConfiguration {

    private static final String PROMPT_TEXT = "lumen";
    private static final int SHORT_ID_LENGTH = 8;

    private static final AttributedStyle STYLE_PROMPT = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN);
    private static final AttributedStyle STYLE_SESSION = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);

    @Bean
    public PromptProvider lumenPrompt(TutorCommands tutorCommands) {
        return () -> {
            var builder = new AttributedStringBuilder().append(PROMPT_TEXT, STYLE_PROMPT);
            String sessionId = tutorCommands.getCurrentSessionId();
            if (sessionId != null) {
                String shortId = sessionId.length() > SHORT_ID_LENGTH ? sessionId.substring(0, SHORT_ID_LENGTH) : sessionId;
                builder.append(" [" + shortId + "]", STYLE_SESSION);
            }
            return builder.append(" > ", STYLE_PROMPT).toAttributedString();
        };
    }
}
