package com.myorg.ebus.eventing;

public interface PayloadConverter {
    <T> T read(byte[] body, Class<T> type);
}
