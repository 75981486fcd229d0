package com.tessera.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 引擎自定义异常基类。
 * <p>
 * 引擎自身识别的所有错误都通过此类（或其子类）抛出，包含错误码和描述信息。
 * Runner 在包装驱动异常时，遇到 EngineException 会原样透传，不再二次包装。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class EngineException extends RuntimeException {

    private static final long serialVersionUID = 2871603955714420087L;

    /** 错误码 */
    private String code;

    /** 错误信息 */
    private String info;

    /**
     * 创建包含错误码和描述信息的 EngineException。
     *
     * @param code 错误码
     * @param message 错误描述信息
     */
    public EngineException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含错误码、描述信息和原因的 EngineException。
     *
     * @param code 错误码
     * @param message 错误描述信息
     * @param cause 错误原因
     */
    public EngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return getClass().getName() + "{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
