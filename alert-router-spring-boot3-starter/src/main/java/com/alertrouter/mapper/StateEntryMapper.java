package com.alertrouter.mapper;

import com.alertrouter.model.entity.StateEntryEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface StateEntryMapper extends BaseMapper<StateEntryEntity> {

    @Select("""
        select state_value from alert_router_state
        where namespace = #{ns} and state_key = #{key}
    """)
    String selectValue(@Param("ns") String ns, @Param("key") String key);

    /**
     * 覆盖写
     */
    @Insert("""
        INSERT INTO alert_router_state (namespace, state_key, state_value, updated_at)
        VALUES (#{ns}, #{key}, #{value}, CURRENT_TIMESTAMP(3))
        ON DUPLICATE KEY UPDATE state_value = VALUES(state_value), updated_at = CURRENT_TIMESTAMP(3)
    """)
    int upsert(@Param("ns") String ns, @Param("key") String key, @Param("value") String value);

    /**
     * 原子自增, 不存在时写入 1
     */
    @Insert("""
        INSERT INTO alert_router_state (namespace, state_key, state_value, updated_at)
        VALUES (#{ns}, #{key}, '1', CURRENT_TIMESTAMP(3))
        ON DUPLICATE KEY UPDATE state_value = CAST(state_value AS SIGNED) + 1, updated_at = CURRENT_TIMESTAMP(3)
    """)
    int incrementValue(@Param("ns") String ns, @Param("key") String key);

    /**
     * 不存在时写入, 已存在返回 0
     */
    @Insert("""
        INSERT IGNORE INTO alert_router_state (namespace, state_key, state_value, updated_at)
        VALUES (#{ns}, #{key}, #{value}, CURRENT_TIMESTAMP(3))
    """)
    int insertIfAbsent(@Param("ns") String ns, @Param("key") String key, @Param("value") String value);

    @Update("""
        UPDATE alert_router_state
        SET state_value = #{value}, updated_at = CURRENT_TIMESTAMP(3)
        WHERE namespace = #{ns} and state_key = #{key} and state_value = #{expected}
    """)
    int updateIfValue(@Param("ns") String ns, @Param("key") String key,
                      @Param("expected") String expected, @Param("value") String value);

    @Delete("""
        DELETE FROM alert_router_state
        WHERE namespace = #{ns} and state_key = #{key}
    """)
    int deleteByKey(@Param("ns") String ns, @Param("key") String key);

    @Delete("""
        DELETE FROM alert_router_state
        WHERE namespace = #{ns} and state_key = #{key} and state_value = #{expected}
    """)
    int deleteIfValue(@Param("ns") String ns, @Param("key") String key, @Param("expected") String expected);

    @Select("""
        select id, namespace, state_key, state_value, updated_at from alert_router_state
        where namespace = #{ns}
        order by state_key asc
    """)
    List<StateEntryEntity> selectByNamespace(@Param("ns") String ns);
}
