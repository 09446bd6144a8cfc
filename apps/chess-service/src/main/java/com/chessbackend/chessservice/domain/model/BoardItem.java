package com.chessbackend.chessservice.domain.model;

/** 棋盘稀疏视图中的一项：位置（代数记法）+ 棋子 */
public record BoardItem(String position, Piece piece) {
}
