package com.mahjongrules.exception;

/**
 * 手牌的面子结构无法成立（副露过多、杠不是四张相同的牌等）
 */
public class MalformedHandException extends MahjongRuleException {

    public MalformedHandException(String message) {
        super(message);
    }
}
