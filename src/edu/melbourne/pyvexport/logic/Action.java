/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.List;

/**
 * An elaborated action of the source module.
 */
public interface Action {

    ActionUpdate update();

    List<Symbol> getFormalParams();
}
