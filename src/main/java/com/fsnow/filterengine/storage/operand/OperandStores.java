package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.model.Keyword;

/**
 * Creates the operand store of a storage keyword.
 */
public final class OperandStores {

    private OperandStores() {}

    public static OperandStore create(Keyword keyword) {
        switch (keyword) {
            case EVERYTHING:
                return new EverythingOperand();
            case EQUALS:
                return new EqualsOperand();
            case EXISTS:
                return new ExistsOperand();
            case NOT_EXISTS:
                return new NotExistsOperand();
            case RANGE:
                return new RangeOperand();
            case NOT_RANGE:
                return new NotRangeOperand();
            case NOT_EQUALS:
                return new NotEqualsOperand();
            case REGEXP:
                return new RegexpOperand();
            case NOT_REGEXP:
                return new NotRegexpOperand();
            case GEOSPATIAL:
                return new GeospatialOperand();
            case NOT_GEOSPATIAL:
                return new NotGeospatialOperand();
            case NOTHING:
                return new NothingOperand();
            default:
                throw new IllegalArgumentException("Unhandled keyword: " + keyword);
        }
    }
}
