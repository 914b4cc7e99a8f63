package com.discovery.serializer;

import java.io.IOException;

/**
 * 序列化器
 *
 * @author sakame
 * @version 1.0
 */
public interface Serializer {

    /**
     * 序列化
     *
     * @param object
     * @param <T>
     * @return
     * @throws IOException
     */
    <T> byte[] serialize(T object) throws IOException;

    /**
     * 反序列化
     *
     * @param bytes
     * @param type
     * @param <T>
     * @return
     * @throws IOException 内容不是合法格式
     */
    <T> T deserialize(byte[] bytes, Class<T> type) throws IOException;
}
