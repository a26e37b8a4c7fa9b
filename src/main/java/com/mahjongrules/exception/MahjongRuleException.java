package com.mahjongrules.exception;

/**
 * 规则核心的异常基类
 * 这类异常说明调用方维护的牌局状态有误，而不是一种合法的牌局结果
 */
public class MahjongRuleException extends RuntimeException {

    public MahjongRuleException(String message) {
        super(message);
    }
}
