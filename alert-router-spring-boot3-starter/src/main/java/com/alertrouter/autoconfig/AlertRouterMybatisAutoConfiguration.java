package com.alertrouter.autoconfig;

import com.alertrouter.core.spi.StateStore;
import com.alertrouter.core.store.MybatisStateStore;
import com.alertrouter.mapper.StateEntryMapper;
import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * 存在数据源与 MyBatis-Plus 时使用数据库状态存储
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "com.baomidou.mybatisplus.autoconfigure.MybatisPlusAutoConfiguration"
})
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean(DataSource.class)
@MapperScan(basePackages = "com.alertrouter.mapper")
public class AlertRouterMybatisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    @ConditionalOnBean(PlatformTransactionManager.class)
    public StateStore mybatisStateStore(StateEntryMapper mapper, PlatformTransactionManager tm) {
        // 状态写入自成事务, 不加入调用方事务
        TransactionTemplate tt = new TransactionTemplate(tm);
        tt.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRES_NEW);
        return new MybatisStateStore(mapper, tt);
    }
}
