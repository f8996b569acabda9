package dumb.narsese.lexical;

import dumb.narsese.fold.FoldException;
import dumb.narsese.fold.Folder;
import dumb.narsese.fold.Vocabulary;
import dumb.narsese.term.Task;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A sentence behind a budget marker. An empty {@code budget} list is the explicit {@code $$}
 * form; text without any budget marker parses as a {@link LexicalSentence} instead.
 */
public record LexicalTask(List<String> budget, LexicalSentence sentence) implements LexicalNarsese {

    public LexicalTask {
        budget = List.copyOf(budget);
        requireNonNull(sentence);
    }

    @Override
    public LexicalTerm term() {
        return sentence.term();
    }

    @Override
    public Task narrow() throws FoldException {
        return Folder.foldTask(this);
    }

    @Override
    public String narsese() {
        return Vocabulary.ASCII.render(this);
    }
}
