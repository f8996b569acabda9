package dumb.narsese.lexical;

import dumb.narsese.fold.FoldException;
import dumb.narsese.fold.Folder;
import dumb.narsese.fold.Vocabulary;
import dumb.narsese.term.Sentence;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A term with punctuation, and optionally a stamp and a truth marker.
 *
 * @param stamp content between the colons of {@code :...:}, or null when absent
 * @param truth numeric tokens between the percent signs of {@code %...%}, or null when absent.
 *              An empty list stands for {@code %%}.
 */
public record LexicalSentence(LexicalTerm term, String punctuation, @Nullable String stamp,
                              @Nullable List<String> truth) implements LexicalNarsese {

    public LexicalSentence {
        requireNonNull(term);
        requireNonNull(punctuation);
        if (truth != null) truth = List.copyOf(truth);
    }

    public LexicalSentence(LexicalTerm term, String punctuation) {
        this(term, punctuation, null, null);
    }

    public boolean hasStamp() {
        return stamp != null;
    }

    public boolean hasTruth() {
        return truth != null;
    }

    @Override
    public Sentence narrow() throws FoldException {
        return Folder.foldSentence(this);
    }

    @Override
    public String narsese() {
        return Vocabulary.ASCII.render(this);
    }
}
