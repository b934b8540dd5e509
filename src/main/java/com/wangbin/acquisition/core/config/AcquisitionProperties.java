package com.wangbin.acquisition.core.config;

import com.wangbin.acquisition.core.overflow.OverflowEvictionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * acquisition 配置映射
 * <p>
 * 单字段约束在绑定时由 Bean Validation 校验，跨字段规则见 {@link AcquisitionPropertiesValidator}
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "acquisition")
public class AcquisitionProperties {

    /**
     * 是否启动采集流水线（关闭后仅保留 HTTP 接口）
     */
    private boolean enabled = true;

    /**
     * 停机时每个阶段的最大等待时间（毫秒）
     */
    @Positive(message = "shutdownTimeoutMs 必须大于 0")
    private long shutdownTimeoutMs = 10000;

    @Valid
    private final Plc plc = new Plc();

    @Valid
    private final Poll poll = new Poll();

    @Valid
    private final Batch batch = new Batch();

    @Valid
    private final Overflow overflow = new Overflow();

    @Valid
    private final Broadcast broadcast = new Broadcast();

    @Valid
    private final Store store = new Store();

    /**
     * 采集设备清单
     */
    @NotEmpty(message = "至少需要配置一个设备")
    private List<@Valid DeviceDefinition> devices = new ArrayList<>();

    /**
     * 模块类型 -> 字段 -> 换算规则
     */
    private Map<String, Map<String, ConversionRule>> conversions = new LinkedHashMap<>();

    public boolean isMockMode() {
        return "mock".equalsIgnoreCase(plc.getMode());
    }

    @Data
    public static class Plc {
        /**
         * modbus / mock
         */
        @Pattern(regexp = "(?i)modbus|mock", message = "plc.mode 只支持 modbus 或 mock")
        private String mode = "modbus";
        private String host = "192.168.50.223";
        @Min(value = 1, message = "plc.port 必须在 1-65535 之间")
        @Max(value = 65535, message = "plc.port 必须在 1-65535 之间")
        private int port = 502;
        @Positive
        private long connectTimeoutMs = 5000;
        @Positive
        private long readTimeoutMs = 5000;
        /**
         * 单次读取的最大尝试次数
         */
        @Min(1)
        private int readMaxAttempts = 2;
        /**
         * 读取重试前的等待时间
         */
        @PositiveOrZero
        private long readRetryDelayMs = 2000;
        /**
         * 单次重连调用内的最大连接尝试次数
         */
        @Min(1)
        private int reconnectMaxAttempts = 3;
        /**
         * 两次连接尝试之间的退避时间
         */
        @PositiveOrZero
        private long reconnectBackoffMs = 1000;
        /**
         * 连续错误达到该值后，下一次读取前强制重连
         */
        @Min(1)
        private int errorThreshold = 3;
    }

    @Data
    public static class Poll {
        @Positive(message = "poll.intervalMs 必须大于 0")
        private long intervalMs = 5000;
        /**
         * 每隔多少个周期输出一次汇总日志
         */
        @Positive
        private int summaryEveryCycles = 10;
        /**
         * 输出每个周期的详细日志
         */
        private boolean verbose = false;
    }

    @Data
    public static class Batch {
        /**
         * 多少个轮询周期后批量写入
         */
        @Min(1)
        private int cycleThreshold = 12;
        /**
         * 缓冲区数据点上限，达到后立即写入
         */
        @Positive
        private int maxPoints = 500;
        /**
         * 缓冲区最长滞留时间
         */
        @Positive
        private long maxAgeMs = 120000;
        @Positive
        private long ageCheckIntervalMs = 5000;
        @NotBlank
        private String measurement = "sensor_data";
    }

    @Data
    public static class Overflow {
        @NotBlank(message = "overflow.path 不能为空")
        private String path = "data/overflow-cache.db";
        @Positive
        private long maxRecords = 100000;
        @NotNull
        private OverflowEvictionPolicy evictionPolicy = OverflowEvictionPolicy.DROP_OLDEST;
        @Positive
        private long replayIntervalMs = 60000;
        @Positive
        private int replayBatchSize = 100;
        @Positive
        private int maxRecordsPerPass = 5000;
        /**
         * 单条记录被时序库拒绝的次数上限，达到后丢弃并计入 evicted
         */
        @Min(1)
        private int maxAttempts = 5;
        /**
         * 缓存保留天数，0 表示不清理
         */
        @PositiveOrZero
        private int retentionDays = 7;
        @Positive
        private long purgeIntervalMs = 3600000;
        @PositiveOrZero
        private int busyTimeoutMs = 5000;
    }

    @Data
    public static class Broadcast {
        @NotBlank
        private String path = "/ws/realtime";
        private String[] allowedOrigins = {"*"};
        @Positive
        private long pushIntervalMs = 1000;
        @Positive
        private long heartbeatTimeoutMs = 45000;
        @Positive
        private long reaperIntervalMs = 10000;
        /**
         * 可订阅的频道，目前只有 realtime
         */
        @NotEmpty
        private List<String> channels = new ArrayList<>(List.of("realtime"));
        /**
         * 单条消息发送的最长阻塞时间
         */
        @Positive
        private int sendTimeLimitMs = 5000;
        /**
         * 慢客户端的待发送缓冲上限（字节），超过后断开
         */
        @Positive
        private int sendBufferSizeLimit = 512 * 1024;
        /**
         * 每隔多少次推送输出一次汇总日志
         */
        @Positive
        private int summaryEveryPushes = 50;
    }

    @Data
    public static class Store {
        @Pattern(regexp = "https?://.+", message = "store.url 必须以 http:// 或 https:// 开头")
        private String url = "http://localhost:8086";
        private String token;
        @NotBlank
        private String org = "ceramic-workshop";
        @NotBlank
        private String bucket = "sensor_data";
        @Positive
        private long connectTimeoutMs = 5000;
        @Positive
        private long requestTimeoutMs = 30000;
    }

    @Data
    public static class DeviceDefinition {
        @NotBlank(message = "deviceId 不能为空")
        private String deviceId;
        private String deviceName;
        private String deviceType;
        private String moduleType;
        /**
         * 数据块编号（Modbus 下为从站地址）
         */
        @PositiveOrZero
        private int blockId;
        /**
         * 块内起始字节偏移
         */
        @PositiveOrZero
        private int offset = 0;
        /**
         * 读取字节数
         */
        @Positive(message = "设备读取字节数必须大于 0")
        private int size;
        private boolean enabled = true;
        private List<@Valid FieldDefinition> fields = new ArrayList<>();
    }

    @Data
    public static class FieldDefinition {
        @NotBlank(message = "字段名不能为空")
        private String name;
        /**
         * 相对设备起始偏移的字节位置
         */
        @PositiveOrZero
        private int offset;
        @NotBlank
        private String type = "REAL";
        /**
         * BOOL 类型的位序号
         */
        @Min(0)
        @Max(7)
        private int bit = 0;
    }

    @Data
    public static class ConversionRule {
        private double scale = 1.0;
        private double offset = 0.0;
        /**
         * 保留小数位，负数表示不处理
         */
        private int precision = -1;
    }
}
