package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.UserEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

public interface UserMapper extends BaseMapper<UserEntity> {

    @Select("select token_version from t_user where id = #{userId}")
    Long selectTokenVersion(@Param("userId") long userId);

    /**
     * 单条 UPDATE 原子递增，不需要先读再写。
     */
    @Update("update t_user set token_version = token_version + 1 where id = #{userId}")
    int incrementTokenVersion(@Param("userId") long userId);
}
