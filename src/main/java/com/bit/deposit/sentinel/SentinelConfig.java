package com.bit.deposit.sentinel;

import com.alibaba.csp.sentinel.annotation.aspectj.SentinelResourceAspect;
import com.alibaba.csp.sentinel.slots.block.RuleConstant;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRuleManager;
import com.bit.deposit.config.DepositConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 存款触发接口的限流：注册注解切面，启动时按配置加载 QPS 规则
 */
@Slf4j
@Configuration
public class SentinelConfig {

    public static final String RECEIVE_RESOURCE = "depositApi:receive";

    private final DepositConfig config;

    public SentinelConfig(DepositConfig config) {
        this.config = config;
    }

    // 处理 @SentinelResource
    @Bean
    public SentinelResourceAspect sentinelResourceAspect() {
        return new SentinelResourceAspect();
    }

    @PostConstruct
    public void loadFlowRules() {
        List<FlowRule> rules = new ArrayList<>();

        FlowRule receiveRule = new FlowRule();
        receiveRule.setResource(RECEIVE_RESOURCE); // 与 @SentinelResource 的 value 一致
        receiveRule.setGrade(RuleConstant.FLOW_GRADE_QPS);
        receiveRule.setCount(config.getReceiveQps());
        rules.add(receiveRule);

        FlowRuleManager.loadRules(rules);
        log.info("限流规则已加载 | 资源: {} | QPS: {}", RECEIVE_RESOURCE, config.getReceiveQps());
    }
}
