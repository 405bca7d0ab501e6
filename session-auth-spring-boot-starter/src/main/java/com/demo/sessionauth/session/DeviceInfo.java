package com.demo.sessionauth.session;

/**
 * 登录设备信息（均可为空）。
 */
public record DeviceInfo(String userAgent, String ip, String platform) {

    public static DeviceInfo unknown() {
        return new DeviceInfo(null, null, null);
    }
}
