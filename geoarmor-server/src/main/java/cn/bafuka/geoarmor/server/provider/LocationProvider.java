package cn.bafuka.geoarmor.server.provider;

/**
 * 位置数据源
 * 共享缓存未命中或记录过期时调用
 */
@FunctionalInterface
public interface LocationProvider {

    /**
     * 查询用户位置
     *
     * @param username 用户名（保留原始大小写）
     * @return 位置原始值，未找到返回 null
     * @throws Exception 数据源调用失败
     */
    String fetchLocation(String username) throws Exception;
}
