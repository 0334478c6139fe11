package com.demo.groupchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GroupChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupChatApplication.class, args);
    }
}
