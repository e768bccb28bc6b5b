/**
 * 组件配置项
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.mqttop.common.discovery;

/**
 * 发现负载中组件字段的缩写键
 */
public enum ComponentOption {
    AVAILABILITY("avty"),
    AVAILABILITY_MODE("avty_mode"),
    AVAILABILITY_TOPIC("avty_t"),
    AVAILABILITY_TEMPLATE("avty_tpl"),
    COMMAND_TOPIC("cmd_t"),
    COMMAND_TEMPLATE("cmd_tpl"),
    DEVICE_CLASS("dev_cla"),
    DISPLAY_PRECISION("dsp_prc"),
    ENABLED_BY_DEFAULT("en"),
    ENTITY_CATEGORY("ent_cat"),
    FORCE_UPDATE("frc_upd"),
    ICON("ic"),
    JSON_ATTRIBUTES_TOPIC("json_attr_t"),
    JSON_ATTRIBUTES_TEMPLATE("json_attr_tpl"),
    NAME("name"),
    OBJECT_ID("obj_id"),
    OPTIONS("ops"),
    PLATFORM("p"),
    PAYLOAD("pl"),
    PAYLOAD_AVAILABLE("pl_avail"),
    PAYLOAD_NOT_AVAILABLE("pl_not_avail"),
    STATE_CLASS("stat_cla"),
    STATE_TOPIC("stat_t"),
    SUGGESTED_DISPLAY_PRECISION("sug_dsp_prc"),
    UNIQUE_ID("uniq_id"),
    UNIT_OF_MEASUREMENT("unit_of_meas"),
    VALUE_TEMPLATE("val_tpl");
    
    private final String key;
    
    ComponentOption(String key) {
        this.key = key;
    }
    
    public String getKey() {
        return key;
    }
}
