package com.tessera.types.exception;

import com.tessera.types.enums.DriverStageEnum;
import com.tessera.types.enums.ResponseCode;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 驱动在 load/explore/count/run/stop 过程中抛出的非引擎异常的统一包装。
 * <p>
 * 保留原始异常作为 cause；stage 标识失败发生的阶段。
 * 只有 load 阶段会附带失败前已加载的结果片段（partialFragments），其余阶段为空。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Getter
public class DriverOperationException extends EngineException {

    private static final long serialVersionUID = -1795527380026931542L;

    /** 失败阶段 */
    private final DriverStageEnum stage;

    /** 失败前已产生的结果片段 */
    private final List<String> partialFragments;

    public DriverOperationException(DriverStageEnum stage, Throwable cause) {
        this(stage, cause, Collections.emptyList());
    }

    public DriverOperationException(DriverStageEnum stage, Throwable cause, List<String> partialFragments) {
        super(ResponseCode.DRIVER_OPERATION_ERROR.getCode(),
                "An exception occurred in the driver while " + stage.getActivity() + ".", cause);
        this.stage = stage;
        this.partialFragments = partialFragments == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(partialFragments);
    }

}
