package com.wangbin.acquisition.core.config;

import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.batch.BatchWriter;
import com.wangbin.acquisition.core.broadcast.BroadcastHub;
import com.wangbin.acquisition.core.broadcast.RealtimeWebSocketHandler;
import com.wangbin.acquisition.core.convert.LinearValueConverter;
import com.wangbin.acquisition.core.convert.ValueConverter;
import com.wangbin.acquisition.core.decode.DeviceLayout;
import com.wangbin.acquisition.core.decode.OffsetMapDecoder;
import com.wangbin.acquisition.core.decode.ReadingDecoder;
import com.wangbin.acquisition.core.lifecycle.AcquisitionExecutors;
import com.wangbin.acquisition.core.lifecycle.AcquisitionLifecycle;
import com.wangbin.acquisition.core.link.DeviceLink;
import com.wangbin.acquisition.core.link.ModbusTcpPlcTransport;
import com.wangbin.acquisition.core.link.PlcTransport;
import com.wangbin.acquisition.core.link.RetryPolicy;
import com.wangbin.acquisition.core.link.SimulatedPlcTransport;
import com.wangbin.acquisition.core.overflow.JdbcOverflowRepository;
import com.wangbin.acquisition.core.overflow.OverflowCache;
import com.wangbin.acquisition.core.overflow.OverflowRepository;
import com.wangbin.acquisition.core.poll.PollScheduler;
import com.wangbin.acquisition.core.snapshot.SnapshotStore;
import com.wangbin.acquisition.core.store.InfluxDbTimeSeriesStore;
import com.wangbin.acquisition.core.store.TimeSeriesStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 采集流水线装配：设备链路、解析、快照、批量写入、溢出缓存与推送中心
 */
@Slf4j
@Configuration
public class AcquisitionConfig {

    private final AcquisitionProperties properties;

    public AcquisitionConfig(AcquisitionProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void validateProperties() {
        AcquisitionPropertiesValidator.validate(properties);
    }

    private List<DeviceLayout> deviceLayouts() {
        List<DeviceLayout> layouts = properties.getDevices().stream()
                .filter(AcquisitionProperties.DeviceDefinition::isEnabled)
                .map(DeviceLayout::from)
                .toList();
        log.info("加载采集设备 {} 个: {}", layouts.size(), layouts.stream().map(DeviceLayout::getDeviceId).toList());
        return layouts;
    }

    @Bean
    public PlcTransport plcTransport() {
        if (properties.isMockMode()) {
            log.info("PLC 模式: mock，使用模拟数据源");
            return new SimulatedPlcTransport();
        }
        AcquisitionProperties.Plc plc = properties.getPlc();
        return new ModbusTcpPlcTransport(plc.getHost(), plc.getPort());
    }

    @Bean
    public DeviceLink deviceLink(PlcTransport plcTransport) {
        AcquisitionProperties.Plc plc = properties.getPlc();
        return new DeviceLink(plcTransport,
                RetryPolicy.of("plc-read", plc.getReadMaxAttempts(), plc.getReadRetryDelayMs()),
                RetryPolicy.of("plc-reconnect", plc.getReconnectMaxAttempts(), plc.getReconnectBackoffMs()),
                plc.getConnectTimeoutMs(), plc.getReadTimeoutMs(), plc.getErrorThreshold());
    }

    @Bean
    public ReadingDecoder readingDecoder() {
        return new OffsetMapDecoder();
    }

    @Bean
    public ValueConverter valueConverter() {
        return new LinearValueConverter(properties.getConversions());
    }

    @Bean
    public TimeSeriesStore timeSeriesStore() {
        return new InfluxDbTimeSeriesStore(properties.getStore());
    }

    @Bean
    public DataSource overflowDataSource() {
        AcquisitionProperties.Overflow overflow = properties.getOverflow();
        Path path = Paths.get(overflow.getPath()).toAbsolutePath();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
        } catch (IOException e) {
            throw AcquisitionException.configException("无法创建溢出缓存目录: " + path.getParent());
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(overflow.getBusyTimeoutMs());
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + path);
        log.info("溢出缓存文件: {}", path);
        return dataSource;
    }

    @Bean
    public OverflowRepository overflowRepository(DataSource overflowDataSource) {
        return new JdbcOverflowRepository(overflowDataSource);
    }

    @Bean
    public OverflowCache overflowCache(OverflowRepository overflowRepository) {
        return new OverflowCache(overflowRepository, properties.getOverflow(), System::currentTimeMillis);
    }

    @Bean
    public BatchWriter batchWriter(TimeSeriesStore timeSeriesStore, OverflowCache overflowCache,
                                   AcquisitionExecutors acquisitionExecutors) {
        return new BatchWriter(timeSeriesStore, overflowCache, properties.getBatch(),
                acquisitionExecutors.getFlush(), System::currentTimeMillis);
    }

    @Bean
    public PollScheduler pollScheduler(DeviceLink deviceLink, ReadingDecoder readingDecoder,
                                       ValueConverter valueConverter, SnapshotStore snapshotStore,
                                       BatchWriter batchWriter) {
        return new PollScheduler(deviceLink, deviceLayouts(), readingDecoder, valueConverter, snapshotStore,
                batchWriter, properties.getPoll(), System::currentTimeMillis);
    }

    @Bean
    public BroadcastHub broadcastHub(SnapshotStore snapshotStore) {
        return new BroadcastHub(snapshotStore, properties.getBroadcast(), System::currentTimeMillis,
                properties.isMockMode());
    }

    @Bean
    public RealtimeWebSocketHandler realtimeWebSocketHandler(BroadcastHub broadcastHub) {
        return new RealtimeWebSocketHandler(broadcastHub, properties.getBroadcast());
    }

    @Bean
    public AcquisitionLifecycle acquisitionLifecycle(AcquisitionExecutors acquisitionExecutors,
                                                     DeviceLink deviceLink, PollScheduler pollScheduler,
                                                     BatchWriter batchWriter, OverflowCache overflowCache,
                                                     TimeSeriesStore timeSeriesStore, BroadcastHub broadcastHub) {
        return new AcquisitionLifecycle(properties, acquisitionExecutors, deviceLink, pollScheduler, batchWriter,
                overflowCache, timeSeriesStore, broadcastHub);
    }
}
