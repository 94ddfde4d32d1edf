package com.lumen.service.impl;

import com.lumen.model.LearnerLevel;
import com.lumen.model.SessionContext;
import com.lumen.service.api.PromptBuilder;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Default {@link PromptBuilder}: fills the topic's prompt template with the learner's context.
 * <p>
 * Supported placeholders are {@code {course_title}}, {@code {topic_title}}, {@code {topic_description}},
 * {@code {learning_objectives}}, {@code {user_level}}, {@code {completed_topics}}, {@code {struggles}}
 * and {@code {completion_marker}}. Substitution is a single pass, so braces inside substituted values
 * (the completion marker itself, for instance) are never expanded again. Unknown placeholders are
 * left untouched. Topics without an authored template use {@link #DEFAULT_TEMPLATE}.
 * </p>
 */
@Service
public class PromptBuilderImpl implements PromptBuilder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");
    private static final String MARKER_PLACEHOLDER = "{completion_marker}";
    private static final int MAX_STRUGGLES = 3;

    static final String NO_COMPLETED_TOPICS = "nenhum tópico concluído ainda";
    static final String NO_STRUGGLES = "nenhuma dificuldade registrada";
    static final String NO_OBJECTIVES = "não informados";

    /**
     * Built-in tutor persona used when the topic carries no template of its own.
     */
    static final String DEFAULT_TEMPLATE = """
            Você é um tutor especialista em {course_title}.

            TÓPICO ATUAL: {topic_title}

            DESCRIÇÃO DO TÓPICO:
            {topic_description}

            OBJETIVOS DE APRENDIZAGEM:
            {learning_objectives}

            CONTEXTO DO ALUNO:
            - Nível: {user_level}
            - Tópicos concluídos: {completed_topics}
            - Dificuldades anteriores: {struggles}

            SUA ABORDAGEM:
            1. Explique o conceito de forma clara e concisa, adaptada ao nível do aluno.
            2. Dê exemplos práticos e do mundo real.
            3. Use analogias quando ajudarem a tornar ideias complexas mais acessíveis.
            4. Faça 3 perguntas progressivas para validar o entendimento: compreensão, aplicação e análise.

            INSTRUÇÕES IMPORTANTES:
            - Seja encorajador e dê dicas em vez de respostas diretas quando o aluno tiver dificuldade.
            - Após cada resposta do aluno, dê um retorno antes de passar à próxima pergunta.
            - Quando o aluno acertar pelo menos 2 das 3 perguntas, inclua o marcador {completion_marker} na sua resposta.
            - Não saia do tópico: {topic_title}.

            Comece apresentando o tópico e a sua explicação.""";

    @Override
    public String build(SessionContext context, String completionMarker) {
        String template = context.promptTemplate() == null || context.promptTemplate().isBlank()
                ? DEFAULT_TEMPLATE
                : context.promptTemplate();

        Map<String, String> values = Map.of(
                "course_title", nullToEmpty(context.courseTitle()),
                "topic_title", nullToEmpty(context.topicTitle()),
                "topic_description", nullToEmpty(context.topicDescription()),
                "learning_objectives", isBlank(context.learningObjectives()) ? NO_OBJECTIVES : context.learningObjectives(),
                "user_level", LearnerLevel.render(context.userLevel()),
                "completed_topics", renderCompletedTopics(context),
                "struggles", renderStruggles(context),
                "completion_marker", completionMarker
        );

        String prompt = substitute(template, values);
        if (!template.contains(MARKER_PLACEHOLDER)) {
            prompt = prompt + "\n\nQuando o aluno demonstrar domínio do tópico, inclua exatamente o marcador "
                    + completionMarker + " na sua resposta.";
        }
        return prompt;
    }

    private String substitute(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String renderCompletedTopics(SessionContext context) {
        if (context.completedTopicIds().isEmpty()) {
            return NO_COMPLETED_TOPICS;
        }
        return "tópicos " + context.completedTopicIds().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
    }

    private String renderStruggles(SessionContext context) {
        if (context.struggleTopics().isEmpty()) {
            return NO_STRUGGLES;
        }
        return context.struggleTopics().stream()
                .limit(MAX_STRUGGLES)
                .collect(Collectors.joining(", "));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
