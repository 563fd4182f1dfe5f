package org.deadstore.dataflow.cfg.block;

/** The implementation of a {@link SpecialBlock}. */
public class SpecialBlockImpl extends SingleSuccessorBlockImpl implements SpecialBlock {

    /** The type of this special basic block. */
    protected final SpecialBlockType specialType;

    public SpecialBlockImpl(SpecialBlockType type, int id) {
        super(BlockType.SPECIAL_BLOCK, id);
        this.specialType = type;
    }

    @Override
    public SpecialBlockType getSpecialType() {
        return specialType;
    }

    @Override
    public String toString() {
        return "SpecialBlock#" + id + "(" + specialType + ")";
    }
}
