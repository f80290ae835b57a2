package com.boardgame.gamegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameGraphApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GameGraphApplication.class, args)));
    }
}
