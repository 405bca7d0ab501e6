package com.demo.sessionauth.spi;

/**
 * 业务系统提供用户加载能力，Starter 只依赖此接口。
 */
public interface AuthUserService {

    /**
     * 登录：根据用户名加载用户信息（业务自定义 username 含义：账号/邮箱/手机号等）。
     *
     * @return 不存在时返回 null
     */
    AuthUser loadByUsername(String username);

    /**
     * 刷新 token：根据 userId 重新加载用户，以最新的角色/权限签发 access token。
     *
     * @return 不存在时返回 null
     */
    AuthUser loadByUserId(String userId);
}
