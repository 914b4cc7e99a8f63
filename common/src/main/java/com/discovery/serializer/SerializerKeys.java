package com.discovery.serializer;

/**
 * 序列化器常量
 *
 * @author sakame
 * @version 1.0
 */
public interface SerializerKeys {

    String JSON = "json";

}
