package com.discovery.server;

/**
 * @author sakame
 * @version 1.0
 */
public interface HttpServer {
    /**
     * 启动一个 http 服务器，端口绑定完成后返回
     * @param port 为 0 时使用随机端口
     */
    void doStart(int port);

    /**
     * 关闭服务器
     */
    void doShutdown();
}
