package io.datalogger.aqi;

public record AqiDevice(String name, String serialNo) {}
