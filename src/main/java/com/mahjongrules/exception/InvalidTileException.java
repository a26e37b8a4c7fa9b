package com.mahjongrules.exception;

/**
 * 花色或点数越界
 */
public class InvalidTileException extends MahjongRuleException {

    public InvalidTileException(String message) {
        super(message);
    }
}
