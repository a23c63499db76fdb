package eu.virtualparadox.ragqa.support;

import eu.virtualparadox.ragqa.rag.answer.AnswerSynthesizer;

/**
 * Returns a fixed-format answer and remembers what it was asked.
 */
public class EchoAnswerSynthesizer implements AnswerSynthesizer {

    private volatile String lastQuestion;
    private volatile String lastContext;
    private volatile String reply;
    private volatile boolean replyOverridden;

    /**
     * Replaces the echo with {@code reply}, which may be {@code null}.
     */
    public EchoAnswerSynthesizer replying(String reply) {
        this.reply = reply;
        this.replyOverridden = true;
        return this;
    }

    public String lastQuestion() {
        return lastQuestion;
    }

    public String lastContext() {
        return lastContext;
    }

    @Override
    public String synthesize(String question, String context) {
        this.lastQuestion = question;
        this.lastContext = context;
        return replyOverridden ? reply : "Answer to: " + question;
    }
}
