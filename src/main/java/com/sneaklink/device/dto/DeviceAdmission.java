package com.sneaklink.device.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 裝置登記結果：永遠 admitted=true，超過上限時 warning=true 並踢掉最久沒用的裝置
 */
@Data
@Builder
public class DeviceAdmission {

    @Builder.Default
    private boolean admitted = true;

    private boolean warning;

    private List<String> evictedDeviceIds;

    /** -1 = 不限 */
    private long maxDevices;

    /** 登記後的裝置數 */
    private int deviceCount;
}
