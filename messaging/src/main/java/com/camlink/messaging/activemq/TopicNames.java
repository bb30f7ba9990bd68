/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.activemq;

/**
 * Translates between MQTT-style topic names (as used by the cameras) and
 * ActiveMQ destination names, using the same mapping as the broker's MQTT
 * transport: {@code /} becomes {@code .}, {@code +} becomes {@code *} and
 * {@code #} becomes {@code >}.
 */
public final class TopicNames {

    private TopicNames() {}

    public static String toDestination(String mqttTopic) {
        StringBuilder sb = new StringBuilder(mqttTopic.length());
        for (char c : mqttTopic.toCharArray()) {
            switch (c) {
                case '/' -> sb.append('.');
                case '+' -> sb.append('*');
                case '#' -> sb.append('>');
                case '.' -> sb.append('/');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String fromDestination(String destination) {
        StringBuilder sb = new StringBuilder(destination.length());
        for (char c : destination.toCharArray()) {
            switch (c) {
                case '.' -> sb.append('/');
                case '*' -> sb.append('+');
                case '>' -> sb.append('#');
                case '/' -> sb.append('.');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
