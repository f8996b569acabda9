package dumb.narsese.lexical;

import dumb.narsese.fold.FoldException;
import dumb.narsese.term.NarseseValue;

/**
 * Anything the parser can return: a bare term, a sentence, or a task.
 */
public sealed interface LexicalNarsese permits LexicalTerm, LexicalSentence, LexicalTask {

    String narsese();

    NarseseValue narrow() throws FoldException;

    /** The term carried by this value, which is the value itself for terms. */
    LexicalTerm term();
}
