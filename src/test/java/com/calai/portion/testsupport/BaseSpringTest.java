package com.calai.portion.testsupport;

import org.springframework.test.context.ActiveProfiles;

/**
 * ✅ Spring 測試共用基底：強制 test profile（模型 backend 全關）
 */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
