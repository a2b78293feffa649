package com.slb.update_backend.common.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageVo<T> {
    private Long total;
    private Integer page;
    private Integer size;
    private List<T> list;

    public <R> PageVo<R> map(Function<T, R> mapper) {
        return new PageVo<>(total, page, size, list.stream().map(mapper).toList());
    }

    public static int offset(int page, int size) {
        return (Math.max(page, 1) - 1) * size;
    }
}
