package de.htwsaar.datalinker.datalink.web;

import java.util.List;

/**
 * Fehlerkörper für Client-Fehler: {@code {"detail":[{"loc":["query","id"],"msg":...,"type":...}]}}.
 */
public record ErrorDetail(List<Item> detail) {

    public record Item(List<String> loc, String msg, String type) {}

    public static ErrorDetail of(String parameter, String msg, String type) {
        return new ErrorDetail(List.of(new Item(List.of("query", parameter), msg, type)));
    }
}
