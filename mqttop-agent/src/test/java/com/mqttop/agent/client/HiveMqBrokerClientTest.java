package com.mqttop.agent.client;

import com.mqttop.agent.config.MqttopProperties;
import com.mqttop.common.client.WillOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HiveMqBrokerClientTest {

    @Test
    void testNotConnectedBeforeConnect() {
        WillOptions will = WillOptions.builder().topic("mqttop/bridge/status").build();

        HiveMqBrokerClient client = new HiveMqBrokerClient(new MqttopProperties.Mqtt(), will);

        assertFalse(client.isConnected());
        assertSame(will, client.getWillOptions());
    }

    @Test
    void testUnsubscribeNothing() {
        HiveMqBrokerClient client = new HiveMqBrokerClient(new MqttopProperties.Mqtt(), WillOptions.disabled());

        assertNull(client.unsubscribe().await());
    }
}
