package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.error.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

/**
 * Grounded answer synthesis through a Spring AI {@link ChatModel}.
 * The system message restricts the model to the supplied context; the user message carries
 * the context followed by the question.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatModelAnswerSynthesizer implements AnswerSynthesizer {

    static final String INSTRUCTIONS = String.join("\n",
            "You are an assistant that answers questions using ONLY the provided context.",
            "Do not invent or fabricate facts.",
            "If the context does not contain the answer, say that the documents do not contain it.",
            "Answer in the language of the question, concisely and precisely."
    );

    private final ChatModel chatModel;

    @Override
    public String synthesize(final String question, final String context) {
        final String user = "Context:\n" + context + "\n\nQuestion: " + question;
        final Prompt prompt = new Prompt(
                new SystemMessage(INSTRUCTIONS),
                new UserMessage(user)
        );

        log.debug("Prompt: \nSystem: {}\nUser: {}", INSTRUCTIONS, user);

        final ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (final RuntimeException e) {
            throw new ProviderException("Answer synthesis failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        final String generatedAnswer = response.getResult().getOutput().getText();
        if (StringUtils.isBlank(generatedAnswer)) {
            return null;
        }
        return generatedAnswer;
    }
}
