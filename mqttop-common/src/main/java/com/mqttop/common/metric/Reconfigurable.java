/**
 * 可重新配置刷新间隔的指标
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.metric;

import java.time.Duration;

/**
 * 支持运行时修改刷新间隔
 */
public interface Reconfigurable {
    
    /**
     * 设置刷新间隔，下一次刷新起生效
     *
     * @param interval 刷新间隔
     */
    void setInterval(Duration interval);
}
