package cn.bafuka.geoarmor.spi;

/**
 * 固定值词表 SPI
 * 只有词表认识的值才会回写到共享缓存
 */
public interface ValueVocabulary {

    /**
     * 将值规范化为词表中的标准名称
     *
     * @param value 原始值
     * @return 标准名称，无法识别返回 null
     */
    String canonicalize(String value);

    /**
     * 值是否在词表内
     *
     * @param value 原始值
     * @return 能识别返回 true
     */
    default boolean isRecognized(String value) {
        return canonicalize(value) != null;
    }
}
