package com.demo.sessionauth.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 方法级认证/授权。
 * <p>
 * 可标注在类或方法上；两者同时存在时角色与权限取并集。
 * <pre>
 * &#64;RequireAuth(roles = {"admin", "editor"}, permissions = "article:publish")
 * </pre>
 */
@Documented
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireAuth {

    /**
     * 任意一个即可（OR）。为空表示只要求已认证。
     */
    String[] roles() default {};

    /**
     * 必须全部具备（AND）。
     */
    String[] permissions() default {};
}
