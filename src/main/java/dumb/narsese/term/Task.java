package dumb.narsese.term;

import dumb.narsese.fold.Folder;
import dumb.narsese.lexical.LexicalTask;

import static java.util.Objects.requireNonNull;

public record Task(Budget budget, Sentence sentence) implements NarseseValue {

    public Task {
        requireNonNull(budget);
        requireNonNull(sentence);
    }

    @Override
    public Term term() {
        return sentence.term();
    }

    @Override
    public LexicalTask widen() {
        return Folder.widenTask(this);
    }

    @Override
    public String narsese() {
        return widen().narsese();
    }
}
