package eu.virtualparadox.ragqa.rag.answer;

public interface AnswerSynthesizer {

    /**
     * @param question user question
     * @param context  retrieved passage contents joined by blank lines
     * @return the answer, or {@code null} when none was produced
     */
    String synthesize(final String question, final String context);

}
