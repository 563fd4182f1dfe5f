package org.deadstore.dataflow.cfg.block;

/**
 * Represents a special basic block; i.e., one of the following:
 *
 * <ul>
 *   <li>Entry block of a function.
 *   <li>Regular exit block of a function.
 * </ul>
 */
public interface SpecialBlock extends SingleSuccessorBlock {

    /** The types of special basic blocks. */
    enum SpecialBlockType {

        /** The entry block of a function. */
        ENTRY,

        /** The exit block of a function, reached by falling off the end, return or raise. */
        EXIT,
    }

    /** @return the type of this special basic block */
    SpecialBlockType getSpecialType();
}
