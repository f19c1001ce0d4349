package com.saddlery.role.service;

import com.saddlery.role.mapper.FitterMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * fitter 名册：只回答某个账号是否登记为 fitter。
 */
@Service
@RequiredArgsConstructor
public class FitterRoster {

    private final FitterMapper fitterMapper;

    @Transactional(readOnly = true)
    public boolean isMember(long rosterKey) {
        return fitterMapper.existsByUserId(rosterKey);
    }
}
